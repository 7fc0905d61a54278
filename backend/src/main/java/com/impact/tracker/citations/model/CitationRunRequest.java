package com.impact.tracker.citations.model;

import java.time.LocalDate;
import java.util.List;
import java.util.TreeSet;

public record CitationRunRequest(
    List<LocalDate> cutoffDates,
    Boolean writeReport
) {
    public List<LocalDate> normalizedCutoffDates() {
        if (cutoffDates == null) {
            return List.of();
        }
        TreeSet<LocalDate> out = new TreeSet<>();
        for (LocalDate date : cutoffDates) {
            if (date != null) {
                out.add(date);
            }
        }
        return List.copyOf(out);
    }

    public boolean shouldWriteReport() {
        return writeReport == null || writeReport;
    }
}
