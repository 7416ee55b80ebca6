package com.phillippitts.swarmcouncil.service.quality;

import com.phillippitts.swarmcouncil.config.properties.QualityProperties;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredMetadataGeneratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:30:00Z");

    private StructuredMetadataGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new StructuredMetadataGenerator(new QualityProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ContentDraft draft(String title, List<String> tags, String snippet) {
        return new ContentDraft(title, "How to brew it", "one two three four", tags, null, null, null, snippet, null);
    }

    @Test
    void buildsArticleMetadata() {
        StructuredMetadata metadata = generator.generate(
                draft("Thai Tea Guide", List.of("drinks", "thai tea", "recipes"), null), " thai tea ", "Article");

        assertThat(metadata.type()).isEqualTo("Article");
        assertThat(metadata.headline()).isEqualTo("Thai Tea Guide");
        assertThat(metadata.description()).isEqualTo("How to brew it");
        assertThat(metadata.organizationName()).isEqualTo("RBCK CMS");
        assertThat(metadata.organizationUrl()).isEqualTo("https://rbck-cms.render.com");
        assertThat(metadata.canonicalUrl()).isEqualTo("https://rbck-cms.render.com");
        assertThat(metadata.datePublished()).isEqualTo(NOW);
        assertThat(metadata.dateModified()).isEqualTo(NOW);
        assertThat(metadata.keywords()).containsExactly("thai tea", "drinks", "recipes");
        assertThat(metadata.wordCount()).isEqualTo(4);
        assertThat(metadata.abstractText()).isNull();
    }

    @Test
    void otherContentTypesAreBlogPostings() {
        assertThat(generator.generate(draft("T", List.of(), null), "k", "blog").type()).isEqualTo("BlogPosting");
        assertThat(generator.generate(draft("T", List.of(), null), "k", null).type()).isEqualTo("BlogPosting");
    }

    @Test
    void missingTitleBecomesUntitled() {
        assertThat(generator.generate(draft(null, List.of(), null), "k", "article").headline()).isEqualTo("Untitled");
        assertThat(generator.generate(draft("  ", List.of(), null), "k", "article").headline()).isEqualTo("Untitled");
    }

    @Test
    void rendersJsonLd() {
        String markup = generator.schemaMarkup(
                draft("Thai Tea Guide", List.of("drinks"), "Thai tea is sweet."), "thai tea", "article");

        JSONObject json = new JSONObject(markup);
        assertThat(json.getString("@context")).isEqualTo("https://schema.org");
        assertThat(json.getString("@type")).isEqualTo("Article");
        assertThat(json.getString("keywords")).isEqualTo("thai tea, drinks");
        assertThat(json.getString("datePublished")).isEqualTo("2026-03-01T08:30:00Z");
        assertThat(json.getJSONObject("author").getString("name")).isEqualTo("RBCK CMS");
        assertThat(json.getJSONObject("publisher").getString("@type")).isEqualTo("Organization");
        assertThat(json.getJSONObject("mainEntityOfPage").getString("@id")).isEqualTo("https://rbck-cms.render.com");
        assertThat(json.getInt("wordCount")).isEqualTo(4);
        assertThat(json.getString("abstract")).isEqualTo("Thai tea is sweet.");
    }

    @Test
    void omitsAbstractWithoutSnippet() {
        String markup = generator.schemaMarkup(draft("Thai Tea Guide", List.of(), ""), "thai tea", "article");

        assertThat(new JSONObject(markup).has("abstract")).isFalse();
    }
}
