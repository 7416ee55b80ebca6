package com.phillippitts.swarmcouncil.service.workflow;

import java.util.List;
import java.util.Objects;

/**
 * A named, ordered list of stages.
 */
public record WorkflowDefinition(String name, List<WorkflowStage> stages) {

    public WorkflowDefinition {
        Objects.requireNonNull(name, "name");
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Workflow " + name + " must have at least one stage");
        }
        stages = List.copyOf(stages);
    }
}
