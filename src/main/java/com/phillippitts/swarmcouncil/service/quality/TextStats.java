package com.phillippitts.swarmcouncil.service.quality;

import java.util.Locale;

/**
 * Word and keyword counting shared by scoring and metadata generation.
 */
final class TextStats {

    private TextStats() {}

    /** Number of whitespace-separated tokens; 0 for blank text. */
    static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    /** Literal, case-insensitive, non-overlapping occurrences of {@code needle}. */
    static int countOccurrences(String text, String needle) {
        if (text == null || needle == null || needle.isEmpty()) {
            return 0;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        String target = needle.toLowerCase(Locale.ROOT);
        int count = 0;
        int from = 0;
        while (true) {
            int idx = haystack.indexOf(target, from);
            if (idx < 0) {
                return count;
            }
            count++;
            from = idx + target.length();
        }
    }

    static boolean containsIgnoreCase(String text, String needle) {
        return countOccurrences(text, needle) > 0;
    }
}
