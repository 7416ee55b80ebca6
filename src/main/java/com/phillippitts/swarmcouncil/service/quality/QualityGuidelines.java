package com.phillippitts.swarmcouncil.service.quality;

import java.util.List;
import java.util.Map;

/**
 * Active scoring thresholds, published for clients writing content by hand.
 */
public record QualityGuidelines(
        int titleMinLength,
        int titleMaxLength,
        int descriptionMinLength,
        int descriptionMaxLength,
        int fullLengthWords,
        int shortLengthWords,
        double keywordDensityMin,
        double keywordDensityMax,
        double qualitativeWeight,
        double seoWeight,
        Map<String, List<String>> indicators
) {
}
