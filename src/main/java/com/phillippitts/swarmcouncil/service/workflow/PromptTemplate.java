package com.phillippitts.swarmcouncil.service.workflow;

/**
 * Builds the prompt sent to a stage's provider.
 */
@FunctionalInterface
public interface PromptTemplate {

    /**
     * @param originalPrompt the caller's prompt
     * @param buffer         current content buffer; {@code null} before the first executed stage
     * @return the prompt for this stage
     */
    String render(String originalPrompt, String buffer);
}
