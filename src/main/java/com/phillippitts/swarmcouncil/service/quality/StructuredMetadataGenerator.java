package com.phillippitts.swarmcouncil.service.quality;

import com.phillippitts.swarmcouncil.config.properties.QualityProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Builds {@link StructuredMetadata} from a draft and the configured organization. No external calls.
 */
@Component
public class StructuredMetadataGenerator {

    private final QualityProperties props;
    private final Clock clock;

    @Autowired
    public StructuredMetadataGenerator(QualityProperties props) {
        this(props, Clock.systemUTC());
    }

    StructuredMetadataGenerator(QualityProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.clock = Objects.requireNonNull(clock);
    }

    public StructuredMetadata generate(ContentDraft draft, String keyword, String contentType) {
        Instant now = clock.instant();
        Set<String> keywords = new LinkedHashSet<>();
        if (keyword != null && !keyword.isBlank()) {
            keywords.add(keyword.trim());
        }
        keywords.addAll(draft.suggestedTags());
        QualityProperties.Organization org = props.getOrganization();
        return new StructuredMetadata(
                "article".equalsIgnoreCase(contentType) ? "Article" : "BlogPosting",
                draft.title() == null || draft.title().isBlank() ? "Untitled" : draft.title(),
                draft.metaDescription() == null ? "" : draft.metaDescription(),
                org.getName(),
                org.getUrl(),
                now,
                now,
                org.getUrl(),
                new ArrayList<>(keywords),
                TextStats.wordCount(draft.body()),
                draft.featuredSnippet().isBlank() ? null : draft.featuredSnippet());
    }

    /** JSON-LD markup for the draft as it stands. */
    public String schemaMarkup(ContentDraft draft, String keyword, String contentType) {
        return generate(draft, keyword, contentType).toJsonLd();
    }
}
