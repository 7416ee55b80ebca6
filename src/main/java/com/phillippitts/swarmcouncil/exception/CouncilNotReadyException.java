package com.phillippitts.swarmcouncil.exception;

import java.util.List;

/**
 * Thrown when a workflow or consultation is requested while the council is not operational.
 * The message carries the errors collected during the last initialization attempt.
 */
public class CouncilNotReadyException extends SwarmCouncilException {

    private final String state;
    private final List<String> initializationErrors;

    public CouncilNotReadyException(String councilName, String state, List<String> initializationErrors) {
        super(buildMessage(councilName, state, initializationErrors));
        this.state = state;
        this.initializationErrors = initializationErrors == null ? List.of() : List.copyOf(initializationErrors);
    }

    private static String buildMessage(String councilName, String state, List<String> errors) {
        String base = councilName + " not initialized (state=" + state + ")";
        if (errors == null || errors.isEmpty()) {
            return base;
        }
        return base + ". Errors: " + String.join("; ", errors);
    }

    public String getState() {
        return state;
    }

    public List<String> getInitializationErrors() {
        return initializationErrors;
    }
}
