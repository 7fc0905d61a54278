package com.impact.tracker.citations.model;

import java.util.List;

/**
 * Outcome of one provider lookup. Callers treat {@link NotFound} and
 * {@link Failed} alike (no citations from that provider) but log them
 * differently.
 */
public sealed interface CitationBundle
    permits CitationBundle.NotFound, CitationBundle.Failed, CitationBundle.Found {

    List<CitationRecord> citations();

    String describe();

    record NotFound(String lookup) implements CitationBundle {
        @Override
        public List<CitationRecord> citations() {
            return List.of();
        }

        @Override
        public String describe() {
            return "not_found";
        }
    }

    record Failed(String reason, String detail) implements CitationBundle {
        @Override
        public List<CitationRecord> citations() {
            return List.of();
        }

        @Override
        public String describe() {
            return "error:" + reason;
        }
    }

    record Found(PublicationInfo publication, List<CitationRecord> citations) implements CitationBundle {
        public Found {
            citations = citations == null ? List.of() : List.copyOf(citations);
        }

        @Override
        public String describe() {
            return "found(" + citations.size() + ")";
        }
    }
}
