package com.impact.tracker.citations.service;

import com.impact.tracker.citations.model.AggregationResult;
import com.impact.tracker.citations.model.CitationRecord;
import com.impact.tracker.citations.model.CitationSnapshot;
import com.impact.tracker.citations.model.DatedAggregation;
import com.impact.tracker.citations.util.CitationDates;
import com.impact.tracker.citations.util.CitationKeys;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Point-in-time citation counts over a snapshot. Pure: no I/O, no state, so any
 * number of cutoff dates can be evaluated against one snapshot.
 */
@Component
public class TemporalAggregator {

    /**
     * Counts the tracked publications with at least one citation dated on or
     * before {@code cutoff}, and the distinct citing DOIs dated on or before it.
     * Citations without a usable date never count; citations without a DOI only
     * count towards the first number.
     */
    public AggregationResult aggregate(LocalDate cutoff, CitationSnapshot snapshot) {
        Objects.requireNonNull(cutoff, "cutoff");
        if (snapshot == null) {
            return new AggregationResult(0, 0);
        }

        int qualifyingPublications = 0;
        Set<String> citingDois = new HashSet<>();
        for (List<CitationRecord> citations : snapshot.citationsByPublication().values()) {
            boolean qualifies = false;
            for (CitationRecord citation : citations) {
                if (!CitationDates.onOrBefore(citation.publicationDate(), cutoff)) {
                    continue;
                }
                qualifies = true;
                String doiKey = CitationKeys.doiKey(citation.doi());
                if (doiKey != null) {
                    citingDois.add(doiKey);
                }
            }
            if (qualifies) {
                qualifyingPublications++;
            }
        }
        return new AggregationResult(qualifyingPublications, citingDois.size());
    }

    public List<DatedAggregation> aggregateAll(List<LocalDate> cutoffs, CitationSnapshot snapshot) {
        List<DatedAggregation> out = new ArrayList<>();
        if (cutoffs == null) {
            return out;
        }
        for (LocalDate cutoff : cutoffs) {
            if (cutoff != null) {
                out.add(new DatedAggregation(cutoff, aggregate(cutoff, snapshot)));
            }
        }
        return out;
    }
}
