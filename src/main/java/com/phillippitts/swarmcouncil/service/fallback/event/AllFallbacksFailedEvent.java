package com.phillippitts.swarmcouncil.service.fallback.event;

import java.time.Instant;

/** Published when no council member could produce fallback content. */
public record AllFallbacksFailedEvent(String council, int attempted, Instant at) {}
