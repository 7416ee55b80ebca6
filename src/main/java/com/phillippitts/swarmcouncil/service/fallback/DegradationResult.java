package com.phillippitts.swarmcouncil.service.fallback;

import java.util.Objects;

/**
 * Outcome of a degradation pass.
 *
 * @param content    fallback content; the sentinel when every provider failed
 * @param providerId provider that produced the content, or {@code null} when none did
 * @param attempts   number of providers tried
 */
public record DegradationResult(String content, String providerId, int attempts) {

    public DegradationResult {
        Objects.requireNonNull(content, "content");
    }

    /** True when a provider produced the content. */
    public boolean recovered() {
        return providerId != null;
    }
}
