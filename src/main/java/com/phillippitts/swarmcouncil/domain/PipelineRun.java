package com.phillippitts.swarmcouncil.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable result of one workflow invocation.
 *
 * <p>{@code currentContent} is the content buffer as left by the last executed stage (or
 * {@code null} if no stage ran). When a stage fails, the buffer keeps the partial progress and
 * the best-effort answer is carried separately in {@code fallbackContent}.
 *
 * @param originalPrompt         caller's prompt
 * @param workflowName           workflow that ran
 * @param steps                  executed stages in order
 * @param currentContent         final content buffer, or {@code null}
 * @param status                 outcome
 * @param error                  failure description, or {@code null}
 * @param fallbackContent        degraded-mode content, or {@code null} if no degradation happened
 * @param fallbackProviderId     provider that produced the fallback, or {@code null}
 * @param participatingProviders providers that were council members when the run started
 * @param startedAt              start time
 * @param durationMs             wall time of the run
 */
public record PipelineRun(
        String originalPrompt,
        String workflowName,
        List<StepRecord> steps,
        String currentContent,
        RunStatus status,
        String error,
        String fallbackContent,
        String fallbackProviderId,
        List<String> participatingProviders,
        Instant startedAt,
        long durationMs
) {

    public PipelineRun {
        Objects.requireNonNull(originalPrompt, "originalPrompt");
        Objects.requireNonNull(workflowName, "workflowName");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        steps = steps == null ? List.of() : List.copyOf(steps);
        participatingProviders = participatingProviders == null ? List.of() : List.copyOf(participatingProviders);
    }

    /**
     * Returns the content a caller should display: the fallback when degraded, else the buffer.
     */
    public String effectiveContent() {
        return fallbackContent != null ? fallbackContent : currentContent;
    }

    public boolean isDegraded() {
        return status == RunStatus.DEGRADED;
    }
}
