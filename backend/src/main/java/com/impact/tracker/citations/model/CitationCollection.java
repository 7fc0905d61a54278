package com.impact.tracker.citations.model;

import java.util.List;

public record CitationCollection(
    CitationSnapshot snapshot,
    List<PublicationCitationSummary> publications
) {
}
