package com.impact.tracker.citations.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AggregationResult(
    @JsonProperty("num_original_pubs") int numOriginalPubs,
    @JsonProperty("num_citing_pubs") int numCitingPubs
) {
}
