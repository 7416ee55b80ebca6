package com.phillippitts.swarmcouncil.service.council;

/**
 * Initialization state of a council.
 */
public enum CouncilState {
    UNINITIALIZED,
    INITIALIZING,
    /** Some candidates failed; the council still serves requests. */
    PARTIALLY_INITIALIZED,
    FULLY_INITIALIZED,
    FAILED_INITIALIZATION;

    /** True when workflows and consultations may run. */
    public boolean isOperational() {
        return this == PARTIALLY_INITIALIZED || this == FULLY_INITIALIZED;
    }
}
