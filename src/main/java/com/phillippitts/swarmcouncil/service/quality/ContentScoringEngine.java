package com.phillippitts.swarmcouncil.service.quality;

import com.phillippitts.swarmcouncil.config.properties.QualityProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Lexical quality scoring of a draft.
 *
 * <p>Qualitative dimensions count distinct indicator keywords in the lower-cased body. The SEO
 * rubric is additive and capped at 100:
 * <ul>
 *   <li>title length in window: 10, title contains keyword: 10</li>
 *   <li>description length in window: 8, description contains keyword: 7</li>
 *   <li>body word count at full length: 15, else at short length: 10</li>
 *   <li>keyword density in window: 20</li>
 *   <li>heading marker ({@code #} or {@code <h}) in body: 15</li>
 *   <li>schema markup, tags, internal links: 5 each</li>
 * </ul>
 * Results are deterministic for a given draft and keyword.
 */
@Component
public class ContentScoringEngine {

    private final QualityProperties props;

    public ContentScoringEngine(QualityProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    public ScoreResult score(ContentDraft draft, String keyword) {
        String text = draft.body().toLowerCase(Locale.ROOT);
        QualityProperties.Indicators indicators = props.getIndicators();
        int expertise = indicatorScore(text, indicators.getExpertise());
        int experience = indicatorScore(text, indicators.getExperience());
        int authority = indicatorScore(text, indicators.getAuthoritativeness());
        int trust = indicatorScore(text, indicators.getTrustworthiness());
        int qualitative = (int) Math.round((expertise + experience + authority + trust) / 4.0);
        int seo = seoScore(draft, keyword);
        long combined = Math.round(qualitative * props.getQualitativeWeight() + seo * props.getSeoWeight());
        return new ScoreResult(expertise, experience, authority, trust, qualitative, seo, clamp(combined));
    }

    int indicatorScore(String lowerCasedText, List<String> indicators) {
        long present = indicators.stream()
                .map(i -> i.toLowerCase(Locale.ROOT))
                .distinct()
                .filter(i -> !i.isEmpty() && lowerCasedText.contains(i))
                .count();
        return clamp(present * props.getPointsPerIndicator());
    }

    public int seoScore(ContentDraft draft, String keyword) {
        QualityProperties.Seo seo = props.getSeo();
        boolean hasKeyword = keyword != null && !keyword.isBlank();
        int score = 0;

        String title = draft.title();
        if (title != null) {
            if (inRange(title.length(), seo.getTitleMinLength(), seo.getTitleMaxLength())) {
                score += 10;
            }
            if (hasKeyword && TextStats.containsIgnoreCase(title, keyword)) {
                score += 10;
            }
        }

        String description = draft.metaDescription();
        if (description != null) {
            if (inRange(description.length(), seo.getDescriptionMinLength(), seo.getDescriptionMaxLength())) {
                score += 8;
            }
            if (hasKeyword && TextStats.containsIgnoreCase(description, keyword)) {
                score += 7;
            }
        }

        String body = draft.body();
        int words = TextStats.wordCount(body);
        if (words >= seo.getFullLengthWords()) {
            score += 15;
        } else if (words >= seo.getShortLengthWords()) {
            score += 10;
        }
        double density = keywordDensity(body, keyword, words);
        if (hasKeyword && density >= seo.getDensityMin() && density <= seo.getDensityMax()) {
            score += 20;
        }

        if (body.contains("#") || body.contains("<h")) {
            score += 15;
        }

        if (draft.hasSchemaMarkup()) {
            score += 5;
        }
        if (!draft.suggestedTags().isEmpty()) {
            score += 5;
        }
        if (!draft.internalLinks().isEmpty()) {
            score += 5;
        }
        return Math.min(score, 100);
    }

    /** Keyword occurrences per 100 words; 0 for an empty body. */
    static double keywordDensity(String body, String keyword, int wordCount) {
        if (wordCount == 0) {
            return 0.0;
        }
        return TextStats.countOccurrences(body, keyword) * 100.0 / wordCount;
    }

    private static boolean inRange(double value, double min, double max) {
        return value >= min && value <= max;
    }

    private static int clamp(long value) {
        return (int) Math.max(0, Math.min(100, value));
    }
}
