package com.impact.tracker.citations.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicated citations per tracked publication, keyed by the publication
 * identifier. Immutable once built; insertion order of the catalog is kept.
 */
public record CitationSnapshot(Map<String, List<CitationRecord>> citationsByPublication) {
    public CitationSnapshot {
        Map<String, List<CitationRecord>> copy = new LinkedHashMap<>();
        if (citationsByPublication != null) {
            citationsByPublication.forEach((identifier, citations) ->
                copy.put(identifier, citations == null ? List.of() : List.copyOf(citations)));
        }
        citationsByPublication = Collections.unmodifiableMap(copy);
    }

    public int publicationCount() {
        return citationsByPublication.size();
    }

    public int citationCount() {
        int total = 0;
        for (List<CitationRecord> citations : citationsByPublication.values()) {
            total += citations.size();
        }
        return total;
    }
}
