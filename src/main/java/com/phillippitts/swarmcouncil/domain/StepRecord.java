package com.phillippitts.swarmcouncil.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One executed pipeline stage. Never mutated after it is appended to a run.
 *
 * @param stepIndex     1-based position of the stage in its workflow; skipped stages leave gaps
 * @param role          role the stage is bound to
 * @param providerId    provider that served the stage
 * @param outputContent content buffer after the stage
 * @param timestamp     when the stage finished
 */
public record StepRecord(
        int stepIndex,
        String role,
        String providerId,
        String outputContent,
        Instant timestamp
) {
    public StepRecord {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(outputContent, "outputContent");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
