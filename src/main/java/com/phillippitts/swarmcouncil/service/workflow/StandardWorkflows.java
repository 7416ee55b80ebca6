package com.phillippitts.swarmcouncil.service.workflow;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.phillippitts.swarmcouncil.service.workflow.CouncilRoles.CREATOR;
import static com.phillippitts.swarmcouncil.service.workflow.CouncilRoles.ENHANCER;
import static com.phillippitts.swarmcouncil.service.workflow.CouncilRoles.LOCALIZER;
import static com.phillippitts.swarmcouncil.service.workflow.CouncilRoles.REVIEWER;
import static com.phillippitts.swarmcouncil.service.workflow.CouncilRoles.VALIDATOR;

/**
 * Stage lists of the four base-council workflows.
 *
 * <ul>
 *   <li>full: creator, reviewer, enhancer, validator, localizer</li>
 *   <li>create: creator</li>
 *   <li>review: reviewer</li>
 *   <li>optimize: enhancer</li>
 * </ul>
 */
public final class StandardWorkflows {

    private static final Map<WorkflowName, WorkflowDefinition> DEFINITIONS = new EnumMap<>(WorkflowName.class);

    static {
        DEFINITIONS.put(WorkflowName.FULL, new WorkflowDefinition(WorkflowName.FULL.key(), List.of(
                WorkflowStage.fromPrompt(CREATOR, CouncilRoles.describe(CREATOR)),
                WorkflowStage.refining(REVIEWER,
                        "Please review and improve the quality of the following content",
                        CouncilRoles.describe(REVIEWER)),
                WorkflowStage.refining(ENHANCER,
                        "Please improve the structure and appeal of the following content",
                        CouncilRoles.describe(ENHANCER)),
                WorkflowStage.refining(VALIDATOR,
                        "Please check the technical accuracy of the following content",
                        CouncilRoles.describe(VALIDATOR)),
                WorkflowStage.refining(LOCALIZER,
                        "Please refine the language and cultural fit of the following content",
                        CouncilRoles.describe(LOCALIZER))
        )));
        DEFINITIONS.put(WorkflowName.CREATE, new WorkflowDefinition(WorkflowName.CREATE.key(), List.of(
                WorkflowStage.fromPrompt(CREATOR,
                        "Primary content creator - focus on creative, high-quality content"))));
        DEFINITIONS.put(WorkflowName.REVIEW, new WorkflowDefinition(WorkflowName.REVIEW.key(), List.of(
                WorkflowStage.fromPrompt(REVIEWER,
                        "Quality reviewer - review the content and give constructive feedback"))));
        DEFINITIONS.put(WorkflowName.OPTIMIZE, new WorkflowDefinition(WorkflowName.OPTIMIZE.key(), List.of(
                WorkflowStage.fromPrompt(ENHANCER,
                        "Content enhancer - improve the content and make it more effective"))));
    }

    private StandardWorkflows() {
    }

    public static WorkflowDefinition definitionFor(WorkflowName name) {
        return DEFINITIONS.get(name);
    }
}
