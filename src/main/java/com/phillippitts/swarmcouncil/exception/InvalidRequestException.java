package com.phillippitts.swarmcouncil.exception;

/**
 * Thrown when a caller supplies an invalid prompt, workflow name or role.
 * Raised before any provider is called, so it has no side effects.
 */
public class InvalidRequestException extends SwarmCouncilException {

    private final String field;
    private final String reason;

    public InvalidRequestException(String field, String reason) {
        super(reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
