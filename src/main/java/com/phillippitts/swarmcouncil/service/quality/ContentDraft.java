package com.phillippitts.swarmcouncil.service.quality;

import java.util.List;

/**
 * SEO-structured content assembled while a quality run progresses. Later stages rewrite only the body.
 *
 * @param title             page title
 * @param metaDescription   meta description
 * @param body              content body
 * @param suggestedTags     tag suggestions
 * @param internalLinks     internal link topics
 * @param externalSources   external references
 * @param keywordVariations semantic keyword variants
 * @param featuredSnippet   featured-snippet text, empty when none
 * @param schemaMarkup      JSON-LD markup, or {@code null} until the validator stage ran
 */
public record ContentDraft(
        String title,
        String metaDescription,
        String body,
        List<String> suggestedTags,
        List<String> internalLinks,
        List<String> externalSources,
        List<String> keywordVariations,
        String featuredSnippet,
        String schemaMarkup
) {

    public ContentDraft {
        body = body == null ? "" : body;
        featuredSnippet = featuredSnippet == null ? "" : featuredSnippet;
        suggestedTags = suggestedTags == null ? List.of() : List.copyOf(suggestedTags);
        internalLinks = internalLinks == null ? List.of() : List.copyOf(internalLinks);
        externalSources = externalSources == null ? List.of() : List.copyOf(externalSources);
        keywordVariations = keywordVariations == null ? List.of() : List.copyOf(keywordVariations);
    }

    /** A draft holding only a body. */
    public static ContentDraft ofBody(String body) {
        return new ContentDraft(null, null, body, null, null, null, null, null, null);
    }

    public ContentDraft withBody(String newBody) {
        return new ContentDraft(title, metaDescription, newBody, suggestedTags, internalLinks, externalSources,
                keywordVariations, featuredSnippet, schemaMarkup);
    }

    public ContentDraft withSchemaMarkup(String markup) {
        return new ContentDraft(title, metaDescription, body, suggestedTags, internalLinks, externalSources,
                keywordVariations, featuredSnippet, markup);
    }

    public boolean hasSchemaMarkup() {
        return schemaMarkup != null && !schemaMarkup.isBlank();
    }
}
