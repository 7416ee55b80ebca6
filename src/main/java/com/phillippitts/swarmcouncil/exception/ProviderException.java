package com.phillippitts.swarmcouncil.exception;

/**
 * Thrown when a provider fails to generate content or answer a health probe.
 * Covers transport errors, non-2xx responses and malformed bodies.
 */
public class ProviderException extends SwarmCouncilException {

    private final String providerId;
    private final Integer statusCode;

    public ProviderException(String message) {
        super(message);
        this.providerId = "unknown";
        this.statusCode = null;
    }

    public ProviderException(String message, String providerId) {
        this(message, providerId, null, null);
    }

    public ProviderException(String message, String providerId, Throwable cause) {
        this(message, providerId, null, cause);
    }

    public ProviderException(String message, String providerId, Integer statusCode, Throwable cause) {
        super(message + " (provider: " + providerId + ")", cause);
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    public String getProviderId() {
        return providerId;
    }

    /** HTTP status returned by the backend, or {@code null} when no response was received. */
    public Integer getStatusCode() {
        return statusCode;
    }
}
