package com.impact.tracker.citations.model;

import java.util.Map;

public record PublicationCitationSummary(
    String identifier,
    Map<String, String> sourceOutcomes,
    int rawCitationsCount,
    int mergedCitationsCount
) {
}
