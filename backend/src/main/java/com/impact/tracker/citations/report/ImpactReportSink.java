package com.impact.tracker.citations.report;

import com.impact.tracker.citations.model.DatedAggregation;

import java.time.LocalDate;
import java.util.List;

/**
 * Destination of the per-date counts. Locating where each value goes is the
 * sink's business.
 */
public interface ImpactReportSink {

    /**
     * Report dates on or before {@code today} that have no counts yet.
     */
    List<LocalDate> pendingCutoffDates(LocalDate today);

    void record(List<DatedAggregation> aggregations);
}
