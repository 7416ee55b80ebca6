package com.phillippitts.swarmcouncil.service.quality;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the reviewer stage's SEO-structured output into a {@link ContentDraft}.
 *
 * <p>The output is expected to be a JSON object, possibly wrapped in prose or a code fence.
 * When no object can be read, title, description and snippet are recovered with line patterns
 * and the whole output becomes the body.
 */
@Component
public class SeoStructureParser {
    private static final Logger LOG = LogManager.getLogger(SeoStructureParser.class);

    static final String DEFAULT_TITLE = "Generated Title";
    static final String DEFAULT_DESCRIPTION = "Generated meta description";

    private static final Pattern TITLE = Pattern.compile("title['\":\\s]+([^'\"\\n]{10,60})", Pattern.CASE_INSENSITIVE);
    private static final Pattern DESCRIPTION =
            Pattern.compile("meta[^:]*description['\":\\s]+([^'\"\\n]{50,160})", Pattern.CASE_INSENSITIVE);
    private static final Pattern SNIPPET =
            Pattern.compile("snippet['\":\\s]+([^'\"\\n]{50,200})", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+(.+)$", Pattern.MULTILINE);

    public ContentDraft parse(String output) {
        String text = output == null ? "" : output;
        JSONObject json = extractObject(text);
        if (json != null) {
            String body = json.optString("body", "");
            return new ContentDraft(
                    blankToNull(json.optString("title", null)),
                    blankToNull(json.optString("metaDescription", null)),
                    body.isBlank() ? text : body,
                    strings(json.optJSONArray("suggestedTags")),
                    strings(json.optJSONArray("internalLinks")),
                    strings(json.optJSONArray("externalSources")),
                    strings(json.optJSONArray("keywordVariations")),
                    json.optString("featuredSnippet", ""),
                    null);
        }
        return fallback(text);
    }

    private ContentDraft fallback(String text) {
        String title = firstGroup(TITLE, text);
        if (title == null) {
            title = firstGroup(HEADING, text);
        }
        String description = firstGroup(DESCRIPTION, text);
        if (description == null) {
            description = firstParagraph(text);
        }
        String snippet = firstGroup(SNIPPET, text);
        return new ContentDraft(
                title == null ? DEFAULT_TITLE : title,
                description == null ? DEFAULT_DESCRIPTION : description,
                text, List.of(), List.of(), List.of(), List.of(),
                snippet == null ? "" : snippet,
                null);
    }

    private static JSONObject extractObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        try {
            return new JSONObject(text.substring(start, end + 1));
        } catch (JSONException e) {
            LOG.debug("SEO output is not valid JSON, using line patterns: {}", e.getMessage());
            return null;
        }
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1).trim() : null;
    }

    private static String firstParagraph(String text) {
        for (String paragraph : text.split("\\n\\s*\\n")) {
            String p = paragraph.trim();
            if (p.isEmpty() || p.startsWith("#")) {
                continue;
            }
            String flat = p.replaceAll("\\s+", " ");
            if (flat.length() < 50) {
                return null;
            }
            return flat.length() <= 160 ? flat : flat.substring(0, 160).trim();
        }
        return null;
    }

    private static List<String> strings(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            String s = array.optString(i, "");
            if (!s.isBlank()) {
                out.add(s.trim());
            }
        }
        return out;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
