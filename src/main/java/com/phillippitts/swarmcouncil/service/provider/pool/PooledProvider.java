package com.phillippitts.swarmcouncil.service.provider.pool;

import com.phillippitts.swarmcouncil.service.provider.ContentProvider;

import java.time.Instant;
import java.util.Objects;

/**
 * A provider held by the shared pool together with its last known health.
 *
 * @param providerId identifier
 * @param provider   constructed provider handle
 * @param healthy    outcome of the pool's last probe
 * @param checkedAt  when the probe ran
 * @param lastError  probe error message, or {@code null} when healthy
 */
public record PooledProvider(
        String providerId,
        ContentProvider provider,
        boolean healthy,
        Instant checkedAt,
        String lastError
) {
    public PooledProvider {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(checkedAt, "checkedAt");
    }
}
