package com.impact.tracker.citations.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One citing work as reported by one provider. {@code doi} and
 * {@code publicationDate} may be null; the date is kept exactly as the provider
 * sent it and only interpreted at aggregation time.
 */
public record CitationRecord(
    @JsonProperty("title") String title,
    @JsonProperty("doi") String doi,
    @JsonProperty("publication_date") String publicationDate,
    @JsonProperty("source") CitationSource source
) {
    public CitationRecord {
        title = title == null ? "" : title;
    }

    public boolean hasDoi() {
        return doi != null && !doi.isBlank();
    }
}
