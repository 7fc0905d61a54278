package com.impact.tracker.citations.model;

public record PublicationInfo(
    String providerId,
    String title,
    String doi,
    String publicationDate
) {
}
