package com.impact.tracker.citations.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Pattern;

public final class CitationDates {
    private static final Pattern FULL_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern YEAR_ONLY = Pattern.compile("\\d{4}");

    private CitationDates() {
    }

    /**
     * {@code YYYY-MM-DD} as-is, {@code YYYY} as January 1st. Every other shape,
     * {@code YYYY-MM} included, has no usable date.
     */
    public static Optional<LocalDate> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        try {
            if (FULL_DATE.matcher(value).matches()) {
                return Optional.of(LocalDate.parse(value));
            }
            if (YEAR_ONLY.matcher(value).matches()) {
                return Optional.of(LocalDate.of(Integer.parseInt(value), 1, 1));
            }
        } catch (DateTimeException | NumberFormatException ignored) {
            // impossible calendar dates such as 2021-02-30
        }
        return Optional.empty();
    }

    public static boolean onOrBefore(String raw, LocalDate cutoff) {
        return normalize(raw).map(date -> !date.isAfter(cutoff)).orElse(false);
    }
}
