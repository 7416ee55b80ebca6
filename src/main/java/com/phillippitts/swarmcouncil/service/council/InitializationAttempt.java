package com.phillippitts.swarmcouncil.service.council;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of the most recent (re)initialization.
 *
 * @param attemptedAt       when the attempt started, or {@code null} if none ran yet
 * @param perProviderErrors failures in candidate order
 * @param succeededCount    providers that joined
 * @param totalCount        candidates considered
 */
public record InitializationAttempt(
        Instant attemptedAt,
        List<InitializationError> perProviderErrors,
        int succeededCount,
        int totalCount
) {

    private static final InitializationAttempt NONE = new InitializationAttempt(null, List.of(), 0, 0);

    public InitializationAttempt {
        perProviderErrors = perProviderErrors == null ? List.of() : List.copyOf(perProviderErrors);
    }

    public static InitializationAttempt none() {
        return NONE;
    }

    public List<String> errorMessages() {
        return perProviderErrors.stream().map(InitializationError::describe).toList();
    }
}
