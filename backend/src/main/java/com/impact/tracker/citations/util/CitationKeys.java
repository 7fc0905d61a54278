package com.impact.tracker.citations.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Dedup keys for citing works: a normalized DOI when one is known, otherwise a
 * fixed-length title prefix.
 */
public final class CitationKeys {
    public static final int TITLE_KEY_LENGTH = 50;

    private static final Pattern RESOLVER_PREFIX =
        Pattern.compile("^(?:https?://(?:dx\\.)?doi\\.org/|doi:)", Pattern.CASE_INSENSITIVE);

    private CitationKeys() {
    }

    /**
     * DOI without surrounding whitespace or resolver prefix, original case kept.
     * Returns null when nothing is left.
     */
    public static String bareDoi(String raw) {
        if (raw == null) {
            return null;
        }
        String value = RESOLVER_PREFIX.matcher(raw.trim()).replaceFirst("").trim();
        return value.isEmpty() ? null : value;
    }

    public static String doiKey(String raw) {
        String bare = bareDoi(raw);
        return bare == null ? null : bare.toLowerCase(Locale.ROOT);
    }

    public static String titleKey(String title) {
        if (title == null) {
            return null;
        }
        String trimmed = title.trim();
        if (trimmed.codePointCount(0, trimmed.length()) > TITLE_KEY_LENGTH) {
            trimmed = trimmed.substring(0, trimmed.offsetByCodePoints(0, TITLE_KEY_LENGTH)).trim();
        }
        return trimmed.isEmpty() ? null : trimmed;
    }
}
