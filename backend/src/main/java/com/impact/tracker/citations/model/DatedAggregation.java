package com.impact.tracker.citations.model;

import java.time.LocalDate;

public record DatedAggregation(
    LocalDate cutoffDate,
    AggregationResult result
) {
}
