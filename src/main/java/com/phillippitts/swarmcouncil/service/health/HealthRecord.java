package com.phillippitts.swarmcouncil.service.health;

import java.time.Instant;
import java.util.Objects;

/**
 * Last health observation for one provider. Replaced wholesale on every check.
 *
 * @param providerId    provider id
 * @param lastCheckedAt when the observation was made
 * @param status        observed status
 * @param latencyMs     measured latency, or {@code null} when the check failed
 * @param lastError     failure message, or {@code null} when healthy
 */
public record HealthRecord(
        String providerId,
        Instant lastCheckedAt,
        HealthStatus status,
        Long latencyMs,
        String lastError
) {

    public HealthRecord {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(lastCheckedAt, "lastCheckedAt");
        Objects.requireNonNull(status, "status");
    }

    public static HealthRecord healthy(String providerId, Instant at, long latencyMs) {
        return new HealthRecord(providerId, at, HealthStatus.HEALTHY, latencyMs, null);
    }

    public static HealthRecord unhealthy(String providerId, Instant at, String error) {
        return new HealthRecord(providerId, at, HealthStatus.UNHEALTHY, null, error);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
