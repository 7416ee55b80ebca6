package com.phillippitts.swarmcouncil.domain;

/** Outcome of a workflow run. */
public enum RunStatus {
    RUNNING,
    /** Every assigned stage ran. */
    COMPLETED,
    /** A stage failed and fallback content was produced. */
    DEGRADED,
    /** Cancelled, or no provider could produce fallback content. */
    FAILED
}
