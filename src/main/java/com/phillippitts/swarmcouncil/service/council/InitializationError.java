package com.phillippitts.swarmcouncil.service.council;

import java.time.Instant;

/** A provider that could not join the council during one initialization attempt. */
public record InitializationError(String providerId, String message, Instant timestamp) {

    /** Renders as {@code providerId: message}. */
    public String describe() {
        return providerId + ": " + message;
    }
}
