package com.phillippitts.swarmcouncil.presentation.controller;

import com.phillippitts.swarmcouncil.domain.PipelineRun;
import com.phillippitts.swarmcouncil.presentation.dto.ConsultRequest;
import com.phillippitts.swarmcouncil.presentation.dto.ConsultResponse;
import com.phillippitts.swarmcouncil.presentation.dto.QualityRequest;
import com.phillippitts.swarmcouncil.presentation.dto.WorkflowRequest;
import com.phillippitts.swarmcouncil.service.council.CouncilStatus;
import com.phillippitts.swarmcouncil.service.council.DetailedCouncilStatus;
import com.phillippitts.swarmcouncil.service.council.SwarmCouncil;
import com.phillippitts.swarmcouncil.service.quality.OptimizedContent;
import com.phillippitts.swarmcouncil.service.quality.QualityCouncil;
import com.phillippitts.swarmcouncil.service.quality.QualityGuidelines;
import com.phillippitts.swarmcouncil.service.workflow.CancellationToken;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;

/**
 * REST surface of the councils. Thin adapter: validation of the request shape here, everything
 * else in the councils; errors are mapped by the global exception handler.
 */
@RestController
@RequestMapping("/api/council")
class CouncilController {

    private static final Logger LOG = LogManager.getLogger(CouncilController.class);

    private final SwarmCouncil swarmCouncil;
    private final QualityCouncil qualityCouncil;

    CouncilController(SwarmCouncil swarmCouncil, QualityCouncil qualityCouncil) {
        this.swarmCouncil = swarmCouncil;
        this.qualityCouncil = qualityCouncil;
    }

    @PostMapping("/workflows")
    ResponseEntity<PipelineRun> runWorkflow(@Valid @RequestBody WorkflowRequest request) {
        LOG.info("Workflow requested: workflow={}, timeoutMs={}", request.workflow(), request.timeoutMs());
        PipelineRun run = request.timeoutMs() == null || request.timeoutMs() == 0
                ? swarmCouncil.executeWorkflow(request.prompt(), request.workflow())
                : swarmCouncil.executeWorkflow(request.prompt(), request.workflow(),
                        CancellationToken.withTimeout(Duration.ofMillis(request.timeoutMs())));
        return ResponseEntity.ok(run);
    }

    @PostMapping("/consult")
    ResponseEntity<ConsultResponse> consult(@Valid @RequestBody ConsultRequest request) {
        String answer = swarmCouncil.consult(request.role(), request.question());
        return ResponseEntity.ok(new ConsultResponse(request.role(), answer));
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, CouncilStatus>> status() {
        return ResponseEntity.ok(Map.of(
                "swarm", swarmCouncil.status(),
                "quality", qualityCouncil.status()));
    }

    @GetMapping("/status/detailed")
    ResponseEntity<Map<String, DetailedCouncilStatus>> detailedStatus() {
        return ResponseEntity.ok(Map.of(
                "swarm", swarmCouncil.detailedStatus(),
                "quality", qualityCouncil.detailedStatus()));
    }

    @PostMapping("/reinitialize")
    ResponseEntity<DetailedCouncilStatus> reinitialize() {
        LOG.info("Reinitialization requested");
        return ResponseEntity.ok(swarmCouncil.reinitialize());
    }

    @PostMapping("/quality")
    ResponseEntity<OptimizedContent> quality(@Valid @RequestBody QualityRequest request) {
        LOG.info("Quality content requested: keyword='{}', contentType={}", request.keyword(), request.contentType());
        return ResponseEntity.ok(qualityCouncil.createOptimizedContent(
                request.prompt(), request.keyword(), request.contentType()));
    }

    @GetMapping("/quality/guidelines")
    ResponseEntity<QualityGuidelines> guidelines() {
        return ResponseEntity.ok(qualityCouncil.guidelines());
    }
}
