package com.phillippitts.swarmcouncil.service.health;

/** Health of a single provider as last observed. */
public enum HealthStatus {
    HEALTHY,
    UNHEALTHY,
    CHECKING
}
