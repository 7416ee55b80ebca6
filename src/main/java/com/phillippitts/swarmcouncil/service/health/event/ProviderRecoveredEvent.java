package com.phillippitts.swarmcouncil.service.health.event;

import java.time.Instant;

/** Published when a previously unhealthy provider passes a health check again. */
public record ProviderRecoveredEvent(String council, String providerId, long latencyMs, Instant at) { }
