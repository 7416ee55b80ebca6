package com.phillippitts.swarmcouncil.exception;

/**
 * Thrown when post-construction setup (role, specialties, council context) fails.
 * The council logs it as a warning and still activates the provider.
 */
public class ProviderSetupException extends SwarmCouncilException {

    private final String providerId;
    private final String step;

    public ProviderSetupException(String providerId, String step, Throwable cause) {
        super("Setup step '" + step + "' failed for provider " + providerId + ": " + cause.getMessage(), cause);
        this.providerId = providerId;
        this.step = step;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getStep() {
        return step;
    }
}
