package com.impact.tracker.citations.model;

/**
 * A publication whose citation impact is monitored. The DOI, when present, is
 * both the lookup key and the snapshot identifier.
 */
public record TrackedPublication(String title, String doi) {
    public TrackedPublication {
        title = title == null ? "" : title.trim();
        doi = doi == null ? "" : doi.trim();
    }

    public boolean hasDoi() {
        return !doi.isEmpty();
    }

    public boolean isProcessable() {
        return hasDoi() || !title.isEmpty();
    }

    public String identifier() {
        return hasDoi() ? doi : title;
    }
}
