package com.impact.tracker.citations.service;

import com.impact.tracker.citations.model.CitationRecord;
import com.impact.tracker.citations.util.CitationDates;
import com.impact.tracker.citations.util.CitationKeys;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collapses the citation records every provider returned for one tracked
 * publication into one record per citing work.
 *
 * <p>Records with a DOI are keyed by the normalized DOI and the primary
 * provider's record wins; otherwise the first one seen stands. Records without
 * a DOI are keyed by their title prefix and the earliest usable publication
 * date wins. A title-keyed record is dropped when a DOI-keyed record with the
 * same title prefix is already in the output, so one work is never counted
 * under two identities. Input records are never modified.
 */
@Component
public class CitationMerger {

    public List<CitationRecord> merge(List<CitationRecord> citations) {
        if (citations == null || citations.isEmpty()) {
            return List.of();
        }

        Map<String, CitationRecord> byDoi = new LinkedHashMap<>();
        Map<String, CitationRecord> byTitle = new LinkedHashMap<>();
        for (CitationRecord citation : citations) {
            if (citation == null) {
                continue;
            }
            String doiKey = CitationKeys.doiKey(citation.doi());
            if (doiKey != null) {
                byDoi.merge(doiKey, citation, CitationMerger::preferPrimarySource);
                continue;
            }
            String titleKey = CitationKeys.titleKey(citation.title());
            if (titleKey != null) {
                byTitle.merge(titleKey, citation, CitationMerger::preferEarlierDate);
            }
        }

        List<CitationRecord> merged = new ArrayList<>(byDoi.values());
        Set<String> doiTitleKeys = new HashSet<>();
        for (CitationRecord citation : byDoi.values()) {
            String titleKey = CitationKeys.titleKey(citation.title());
            if (titleKey != null) {
                doiTitleKeys.add(titleKey);
            }
        }
        byTitle.forEach((titleKey, citation) -> {
            if (!doiTitleKeys.contains(titleKey)) {
                merged.add(citation);
            }
        });
        return List.copyOf(merged);
    }

    static CitationRecord preferPrimarySource(CitationRecord held, CitationRecord candidate) {
        if (!held.source().isPrimary() && candidate.source().isPrimary()) {
            return candidate;
        }
        return held;
    }

    static CitationRecord preferEarlierDate(CitationRecord held, CitationRecord candidate) {
        Optional<LocalDate> candidateDate = CitationDates.normalize(candidate.publicationDate());
        if (candidateDate.isEmpty()) {
            return held;
        }
        Optional<LocalDate> heldDate = CitationDates.normalize(held.publicationDate());
        if (heldDate.isEmpty() || candidateDate.get().isBefore(heldDate.get())) {
            return candidate;
        }
        return held;
    }
}
