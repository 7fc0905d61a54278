package com.impact.tracker.citations.api;

import java.util.List;

public record CitationApiRunRequest(
    List<String> cutoffDates,
    Boolean writeReport
) {
}
