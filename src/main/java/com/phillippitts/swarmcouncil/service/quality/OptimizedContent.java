package com.phillippitts.swarmcouncil.service.quality;

import com.phillippitts.swarmcouncil.domain.RunStatus;
import com.phillippitts.swarmcouncil.domain.StepRecord;

import java.time.Instant;
import java.util.List;

/**
 * Result of a quality run.
 *
 * @param originalPrompt         caller's topic prompt
 * @param targetKeyword          keyword the content is optimized for
 * @param contentType            "article" or another content type
 * @param steps                  executed stages
 * @param draft                  final draft; its body is the fallback content after degradation
 * @param scoreResult            scores of the final draft
 * @param structuredMetadata     schema.org metadata of the final draft
 * @param status                 outcome
 * @param error                  failure description, or {@code null}
 * @param fallbackContent        degraded-mode content, or {@code null}
 * @param participatingProviders council members when the run started
 * @param startedAt              start time
 * @param durationMs             wall time of the run
 */
public record OptimizedContent(
        String originalPrompt,
        String targetKeyword,
        String contentType,
        List<StepRecord> steps,
        ContentDraft draft,
        ScoreResult scoreResult,
        StructuredMetadata structuredMetadata,
        RunStatus status,
        String error,
        String fallbackContent,
        List<String> participatingProviders,
        Instant startedAt,
        long durationMs
) {
    public OptimizedContent {
        steps = steps == null ? List.of() : List.copyOf(steps);
        participatingProviders = participatingProviders == null ? List.of() : List.copyOf(participatingProviders);
    }
}
