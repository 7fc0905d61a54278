package com.impact.tracker.citations.model;

import java.time.Instant;
import java.util.List;

public record CitationRunSummary(
    Instant startedAt,
    Instant finishedAt,
    int publicationsProcessed,
    int citationsMerged,
    String snapshotPath,
    boolean reportWritten,
    List<PublicationCitationSummary> publications,
    List<DatedAggregation> aggregations
) {
}
