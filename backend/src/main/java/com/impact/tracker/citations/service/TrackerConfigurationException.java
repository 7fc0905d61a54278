package com.impact.tracker.citations.service;

/**
 * The tracked publication catalog is unusable. Raised before any provider is
 * contacted; the run is aborted and no snapshot is written.
 */
public class TrackerConfigurationException extends RuntimeException {
    public TrackerConfigurationException(String message) {
        super(message);
    }

    public TrackerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
