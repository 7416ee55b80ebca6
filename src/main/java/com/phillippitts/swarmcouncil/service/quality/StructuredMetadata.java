package com.phillippitts.swarmcouncil.service.quality;

import org.json.JSONObject;

import java.time.Instant;
import java.util.List;

/**
 * schema.org article metadata for a finished draft.
 *
 * @param type             "Article" or "BlogPosting"
 * @param headline         title, or "Untitled"
 * @param description      meta description, or empty
 * @param organizationName author and publisher name
 * @param organizationUrl  author and publisher URL
 * @param datePublished    publication time
 * @param dateModified     modification time
 * @param canonicalUrl     main entity page
 * @param keywords         target keyword followed by tags, de-duplicated
 * @param wordCount        body word count
 * @param abstractText     featured snippet, or {@code null}
 */
public record StructuredMetadata(
        String type,
        String headline,
        String description,
        String organizationName,
        String organizationUrl,
        Instant datePublished,
        Instant dateModified,
        String canonicalUrl,
        List<String> keywords,
        int wordCount,
        String abstractText
) {

    public StructuredMetadata {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    /**
     * Renders the metadata as schema.org JSON-LD.
     */
    public String toJsonLd() {
        JSONObject organization = new JSONObject()
                .put("@type", "Organization")
                .put("name", organizationName)
                .put("url", organizationUrl);
        JSONObject schema = new JSONObject()
                .put("@context", "https://schema.org")
                .put("@type", type)
                .put("headline", headline)
                .put("description", description)
                .put("datePublished", datePublished.toString())
                .put("dateModified", dateModified.toString())
                .put("author", organization)
                .put("publisher", new JSONObject(organization.toMap()))
                .put("mainEntityOfPage", new JSONObject()
                        .put("@type", "WebPage")
                        .put("@id", canonicalUrl))
                .put("keywords", String.join(", ", keywords))
                .put("wordCount", wordCount);
        if (abstractText != null && !abstractText.isBlank()) {
            schema.put("abstract", abstractText);
        }
        return schema.toString(2);
    }
}
