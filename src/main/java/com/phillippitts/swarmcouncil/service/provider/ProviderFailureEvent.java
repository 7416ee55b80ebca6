package com.phillippitts.swarmcouncil.service.provider;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a provider call fails (transport error, non-2xx response, malformed body).
 *
 * <p>PII note: never include prompt or generated text in context. Restrict to diagnostics.
 */
public record ProviderFailureEvent(
        String providerId,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public ProviderFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
