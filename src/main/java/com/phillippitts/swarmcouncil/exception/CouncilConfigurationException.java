package com.phillippitts.swarmcouncil.exception;

import java.util.List;

/**
 * Thrown when a council cannot be brought up from its configuration: no enabled providers,
 * an invalid provider entry, or every candidate failing to construct.
 *
 * <p>Fatal to initialization and never retried automatically.
 */
public class CouncilConfigurationException extends SwarmCouncilException {

    private final List<String> errors;

    public CouncilConfigurationException(String message) {
        this(message, List.of());
    }

    public CouncilConfigurationException(String message, List<String> errors) {
        super(errors == null || errors.isEmpty() ? message : message + ": " + String.join("; ", errors));
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
