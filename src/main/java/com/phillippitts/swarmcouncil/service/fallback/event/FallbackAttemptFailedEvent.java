package com.phillippitts.swarmcouncil.service.fallback.event;

import java.time.Instant;

/** Published when a provider fails to produce fallback content. */
public record FallbackAttemptFailedEvent(String council, String providerId, String reason, Instant at) {}
