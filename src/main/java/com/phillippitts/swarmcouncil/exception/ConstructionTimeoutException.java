package com.phillippitts.swarmcouncil.exception;

import java.time.Duration;

/** Thrown when provider construction does not finish within the configured bound. */
public class ConstructionTimeoutException extends ProviderConstructionException {

    private final Duration timeout;

    public ConstructionTimeoutException(String providerId, Duration timeout) {
        super(providerId, "Provider construction timeout after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
