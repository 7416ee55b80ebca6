package com.phillippitts.swarmcouncil.service.health.event;

import java.time.Instant;

/** Published when a provider's health check fails after previously passing. */
public record ProviderUnhealthyEvent(String council, String providerId, String reason, Instant at) { }
