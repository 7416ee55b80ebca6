package com.phillippitts.swarmcouncil.exception;

/**
 * Thrown when a single provider cannot be constructed (unknown identifier, bad endpoint, etc.).
 * Recorded against the initialization attempt; never aborts the initialization loop.
 */
public class ProviderConstructionException extends SwarmCouncilException {

    private final String providerId;

    public ProviderConstructionException(String providerId, String message) {
        super(message + " (provider: " + providerId + ")");
        this.providerId = providerId;
    }

    public ProviderConstructionException(String providerId, String message, Throwable cause) {
        super(message + " (provider: " + providerId + ")", cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
