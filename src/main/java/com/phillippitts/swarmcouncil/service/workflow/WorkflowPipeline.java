package com.phillippitts.swarmcouncil.service.workflow;

import com.phillippitts.swarmcouncil.domain.PipelineRun;
import com.phillippitts.swarmcouncil.domain.RunStatus;
import com.phillippitts.swarmcouncil.domain.StepRecord;
import com.phillippitts.swarmcouncil.exception.ProviderException;
import com.phillippitts.swarmcouncil.exception.StageExecutionException;
import com.phillippitts.swarmcouncil.service.fallback.DegradationManager;
import com.phillippitts.swarmcouncil.service.fallback.DegradationResult;
import com.phillippitts.swarmcouncil.service.metrics.CouncilMetrics;
import com.phillippitts.swarmcouncil.service.provider.ProviderRecord;
import com.phillippitts.swarmcouncil.util.LogSanitizer;
import com.phillippitts.swarmcouncil.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a workflow's stages strictly in order against an evolving content buffer.
 *
 * <p>Execution rules:
 * <ul>
 *   <li>A stage whose role has no assigned provider is skipped and the buffer is unchanged</li>
 *   <li>Stages after the first also need a non-empty buffer, otherwise they are skipped</li>
 *   <li>An executed stage replaces the buffer with its output and appends a {@link StepRecord}</li>
 *   <li>The first failing stage aborts the run and hands over to the {@link DegradationManager}</li>
 *   <li>Cancellation keeps committed steps and returns a FAILED run without degradation</li>
 * </ul>
 */
public class WorkflowPipeline {

    private static final Logger LOG = LogManager.getLogger(WorkflowPipeline.class);

    private static final long CANCEL_POLL_MILLIS = 50L;

    private final Executor executor;
    private final DegradationManager degradation;
    private final CouncilMetrics metrics;

    public WorkflowPipeline(Executor executor, DegradationManager degradation, CouncilMetrics metrics) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.degradation = Objects.requireNonNull(degradation, "degradation");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Executes the workflow. Never throws for provider failures; the outcome is in the returned
     * run's status.
     *
     * @param councilName council name for logs and events
     * @param definition  stages to run
     * @param prompt      validated caller prompt
     * @param directory   member snapshot the run is bound to
     * @param token       caller deadline, or {@link CancellationToken#none()}
     * @return the finished run
     */
    public PipelineRun execute(String councilName,
                               WorkflowDefinition definition,
                               String prompt,
                               RoleDirectory directory,
                               CancellationToken token) {
        Instant startedAt = Instant.now();
        long startNanos = System.nanoTime();
        List<String> participants = directory.inRegistrationOrder().stream()
                .map(ProviderRecord::identifier)
                .toList();
        List<StepRecord> steps = new ArrayList<>();
        String buffer = null;

        ThreadContext.put("workflow", definition.name());
        try {
            LOG.info("[{}] Running workflow '{}' over {} stages (prompt='{}')",
                    councilName, definition.name(), definition.stages().size(), LogSanitizer.preview(prompt));
            List<WorkflowStage> stages = definition.stages();
            for (int i = 0; i < stages.size(); i++) {
                WorkflowStage stage = stages.get(i);
                if (token.isCancelled()) {
                    return finish(councilName, prompt, definition, steps, buffer, RunStatus.FAILED,
                            token.reason(), null, participants, startedAt, startNanos);
                }
                Optional<ProviderRecord> member = directory.forRole(stage.role());
                if (member.isEmpty()) {
                    LOG.debug("[{}] Skipping stage {} ({}): no provider assigned", councilName, i + 1, stage.role());
                    continue;
                }
                if (i > 0 && (buffer == null || buffer.isEmpty())) {
                    LOG.debug("[{}] Skipping stage {} ({}): empty content buffer", councilName, i + 1, stage.role());
                    continue;
                }

                ProviderRecord provider = member.get();
                String stagePrompt = stage.template().render(prompt, buffer);
                String output;
                try {
                    output = invoke(provider, stage, stagePrompt, token);
                } catch (CancellationException e) {
                    LOG.info("[{}] Workflow '{}' cancelled during stage {} ({})",
                            councilName, definition.name(), i + 1, stage.role());
                    return finish(councilName, prompt, definition, steps, buffer, RunStatus.FAILED,
                            token.reason(), null, participants, startedAt, startNanos);
                } catch (RuntimeException e) {
                    StageExecutionException failure =
                            new StageExecutionException(i + 1, stage.role(), provider.identifier(), e);
                    LOG.warn("[{}] {}", councilName, failure.getMessage());
                    DegradationResult fallback =
                            degradation.degrade(councilName, prompt, directory.inRegistrationOrder());
                    return finish(councilName, prompt, definition, steps, buffer,
                            fallback.recovered() ? RunStatus.DEGRADED : RunStatus.FAILED,
                            failure.getMessage(), fallback, participants, startedAt, startNanos);
                }

                buffer = stage.outputMapper().apply(output == null ? "" : output);
                steps.add(new StepRecord(i + 1, stage.role(), provider.identifier(), buffer, Instant.now()));
                LOG.debug("[{}] Stage {} ({}) completed by {} (chars={})",
                        councilName, i + 1, stage.role(), provider.identifier(), buffer.length());
            }
            return finish(councilName, prompt, definition, steps, buffer, RunStatus.COMPLETED,
                    null, null, participants, startedAt, startNanos);
        } finally {
            ThreadContext.remove("workflow");
        }
    }

    private String invoke(ProviderRecord provider, WorkflowStage stage, String stagePrompt, CancellationToken token) {
        long start = System.nanoTime();
        String output;
        if (!token.isCancellable()) {
            output = provider.provider().generate(stagePrompt);
        } else {
            CompletableFuture<String> call;
            try {
                call = CompletableFuture.supplyAsync(() -> provider.provider().generate(stagePrompt), executor);
            } catch (RejectedExecutionException e) {
                throw new ProviderException("Stage call rejected: executor saturated", provider.identifier(), e);
            }
            output = awaitCancellable(call, token);
        }
        metrics.recordStageLatency(provider.identifier(), stage.role(), System.nanoTime() - start);
        return output;
    }

    private static String awaitCancellable(CompletableFuture<String> future, CancellationToken token) {
        while (true) {
            if (token.isCancelled()) {
                future.cancel(true);
                throw new CancellationException(token.reason());
            }
            try {
                return future.get(CANCEL_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // poll again
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new CancellationException("Workflow interrupted");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                throw new IllegalStateException(cause);
            }
        }
    }

    private PipelineRun finish(String councilName,
                               String prompt,
                               WorkflowDefinition definition,
                               List<StepRecord> steps,
                               String buffer,
                               RunStatus status,
                               String error,
                               DegradationResult fallback,
                               List<String> participants,
                               Instant startedAt,
                               long startNanos) {
        PipelineRun run = new PipelineRun(prompt, definition.name(), steps, buffer, status, error,
                fallback == null ? null : fallback.content(),
                fallback == null ? null : fallback.providerId(),
                participants, startedAt, TimeUtils.elapsedMillis(startNanos));
        metrics.recordWorkflowOutcome(definition.name(), status.name());
        LOG.info("[{}] Workflow '{}' finished: status={}, steps={}, durationMs={}",
                councilName, definition.name(), status, steps.size(), run.durationMs());
        return run;
    }
}
