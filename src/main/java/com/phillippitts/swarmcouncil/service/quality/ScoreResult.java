package com.phillippitts.swarmcouncil.service.quality;

/**
 * Quality scores of a finished draft. Every value lies in [0, 100].
 *
 * @param expertise          expertise indicators
 * @param experience         experience indicators
 * @param authoritativeness  authority indicators
 * @param trustworthiness    trust indicators
 * @param overallQualitative rounded mean of the four dimensions
 * @param seoScore           additive SEO rubric, capped
 * @param combinedScore      weighted blend of qualitative and SEO scores
 */
public record ScoreResult(
        int expertise,
        int experience,
        int authoritativeness,
        int trustworthiness,
        int overallQualitative,
        int seoScore,
        int combinedScore
) {
}
