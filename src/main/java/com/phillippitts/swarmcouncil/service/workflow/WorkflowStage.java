package com.phillippitts.swarmcouncil.service.workflow;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A pipeline stage bound to a council role.
 *
 * @param role         role whose provider serves the stage
 * @param template     prompt builder
 * @param outputMapper turns the raw provider output into the new buffer content
 */
public record WorkflowStage(String role, PromptTemplate template, UnaryOperator<String> outputMapper) {

    public WorkflowStage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(template, "template");
        outputMapper = outputMapper == null ? UnaryOperator.identity() : outputMapper;
    }

    public WorkflowStage(String role, PromptTemplate template) {
        this(role, template, UnaryOperator.identity());
    }

    /**
     * Stage that works directly on the caller's prompt: {@code <prompt>\n\nRole: <description>}.
     */
    public static WorkflowStage fromPrompt(String role, String roleDescription) {
        return new WorkflowStage(role, (prompt, buffer) -> prompt + "\n\nRole: " + roleDescription);
    }

    /**
     * Stage that refines the buffer:
     * {@code <instruction>:\n\n<buffer>\n\nRole: <description>}.
     */
    public static WorkflowStage refining(String role, String instruction, String roleDescription) {
        return new WorkflowStage(role,
                (prompt, buffer) -> instruction + ":\n\n" + buffer + "\n\nRole: " + roleDescription);
    }
}
