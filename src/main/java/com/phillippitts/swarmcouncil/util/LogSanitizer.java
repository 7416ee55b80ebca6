package com.phillippitts.swarmcouncil.util;

/** Utility for privacy-safe logging of prompt and content previews. */
public final class LogSanitizer {

    /** Default preview length used for prompts and generated content. */
    public static final int DEFAULT_PREVIEW = 80;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Collapses whitespace (including newlines) to single spaces and truncates, appending "..."
     * when text was cut. Keeps multi-line LLM output on one log line.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        if (flat.length() <= max) {
            return flat;
        }
        return truncate(flat, max) + "...";
    }

    public static String preview(String s) {
        return preview(s, DEFAULT_PREVIEW);
    }

    /**
     * Masks a credential for logs, keeping only the last four characters.
     */
    public static String maskSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            return "<none>";
        }
        if (secret.length() <= 4) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
