package com.impact.tracker.citations.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Bibliographic providers a citation can come from. Declaration order is the
 * merge priority: when two providers report the same citing DOI, the earlier
 * constant wins.
 */
public enum CitationSource {
    OPENALEX("openalex"),
    SEMANTIC_SCHOLAR("semanticscholar");

    private final String wireName;

    CitationSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isPrimary() {
        return this == OPENALEX;
    }

    @JsonCreator
    public static CitationSource fromWireName(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("citation source is missing");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CitationSource source : values()) {
            if (source.wireName.equals(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("unknown citation source: " + raw);
    }
}
