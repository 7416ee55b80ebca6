package com.phillippitts.swarmcouncil.service.council;

import com.phillippitts.swarmcouncil.config.properties.CouncilProperties;
import com.phillippitts.swarmcouncil.domain.PipelineRun;
import com.phillippitts.swarmcouncil.exception.CouncilNotReadyException;
import com.phillippitts.swarmcouncil.exception.InvalidRequestException;
import com.phillippitts.swarmcouncil.service.health.ProviderHealthTracker;
import com.phillippitts.swarmcouncil.service.provider.BoundedProviderFactory;
import com.phillippitts.swarmcouncil.service.provider.ProviderCatalog;
import com.phillippitts.swarmcouncil.service.workflow.CancellationToken;
import com.phillippitts.swarmcouncil.service.workflow.StandardWorkflows;
import com.phillippitts.swarmcouncil.service.workflow.WorkflowName;
import com.phillippitts.swarmcouncil.service.workflow.WorkflowPipeline;

import java.util.List;
import java.util.Objects;

/**
 * Base council: providers join in configuration order and serve the four standard workflows.
 */
public class SwarmCouncil extends AbstractCouncil {

    public static final String NAME = "SwarmCouncil";

    private final WorkflowPipeline pipeline;

    public SwarmCouncil(ProviderCatalog catalog,
                        BoundedProviderFactory factory,
                        ProviderHealthTracker healthTracker,
                        WorkflowPipeline pipeline,
                        CouncilProperties props) {
        super(NAME, catalog, factory, healthTracker, props);
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    /**
     * Runs a workflow under the configured default deadline.
     *
     * @see #executeWorkflow(String, String, CancellationToken)
     */
    public PipelineRun executeWorkflow(String prompt, String workflowName) {
        return executeWorkflow(prompt, workflowName, defaultToken());
    }

    /**
     * Runs a named workflow.
     *
     * @param prompt       non-blank prompt
     * @param workflowName one of full, create, review, optimize
     * @param token        caller deadline or cancellation signal
     * @return the run; provider failures are reported through its status, never thrown
     * @throws CouncilNotReadyException if the council is not operational
     * @throws InvalidRequestException  if the prompt is blank or the workflow unknown
     */
    public PipelineRun executeWorkflow(String prompt, String workflowName, CancellationToken token) {
        Objects.requireNonNull(token, "token");
        return withMembers(members -> {
            requireText("prompt", prompt, "Invalid prompt: must be a non-empty string");
            WorkflowName workflow = WorkflowName.parse(workflowName);
            return pipeline.execute(getName(), StandardWorkflows.definitionFor(workflow), prompt, members, token);
        });
    }

    @Override
    protected List<String> availableWorkflows() {
        return WorkflowName.keys();
    }
}
