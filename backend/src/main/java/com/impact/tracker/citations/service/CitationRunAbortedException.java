package com.impact.tracker.citations.service;

public class CitationRunAbortedException extends RuntimeException {
    public CitationRunAbortedException(String message) {
        super(message);
    }

    public CitationRunAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
