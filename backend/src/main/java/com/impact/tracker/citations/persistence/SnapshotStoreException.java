package com.impact.tracker.citations.persistence;

public class SnapshotStoreException extends RuntimeException {
    public SnapshotStoreException(String message) {
        super(message);
    }

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
