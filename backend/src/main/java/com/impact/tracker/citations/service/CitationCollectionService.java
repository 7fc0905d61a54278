package com.impact.tracker.citations.service;

import com.impact.tracker.config.TrackerProperties;
import com.impact.tracker.citations.model.CitationBundle;
import com.impact.tracker.citations.model.CitationCollection;
import com.impact.tracker.citations.model.CitationRecord;
import com.impact.tracker.citations.model.CitationSnapshot;
import com.impact.tracker.citations.model.PublicationCitationSummary;
import com.impact.tracker.citations.model.TrackedPublication;
import com.impact.tracker.citations.source.CitationSourceAdapter;
import com.impact.tracker.citations.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Fetch and merge phase of a run: every tracked publication is looked up at
 * every provider, the results are merged and the snapshot is assembled once all
 * publications are done.
 */
@Service
public class CitationCollectionService {
    private static final Logger log = LoggerFactory.getLogger(CitationCollectionService.class);

    private final List<CitationSourceAdapter> adapters;
    private final CitationMerger merger;
    private final ExecutorService fetchExecutor;
    private final TrackerProperties properties;

    public CitationCollectionService(
        List<CitationSourceAdapter> adapters,
        CitationMerger merger,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        TrackerProperties properties
    ) {
        List<CitationSourceAdapter> ordered = new ArrayList<>(adapters);
        ordered.sort(Comparator.comparing(CitationSourceAdapter::source));
        this.adapters = List.copyOf(ordered);
        this.merger = merger;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
    }

    public CitationCollection collect(List<TrackedPublication> publications) {
        List<CompletableFuture<PublicationResult>> futures = new ArrayList<>();
        for (TrackedPublication publication : publications) {
            futures.add(CompletableFuture.supplyAsync(() -> collectOne(publication), fetchExecutor));
        }

        Map<String, List<CitationRecord>> citationsByPublication = new LinkedHashMap<>();
        List<PublicationCitationSummary> summaries = new ArrayList<>();
        try {
            for (CompletableFuture<PublicationResult> future : futures) {
                PublicationResult result = future.get();
                citationsByPublication.put(result.summary().identifier(), result.citations());
                summaries.add(result.summary());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            throw new CitationRunAbortedException("citation collection interrupted", e);
        } catch (ExecutionException | CancellationException | CompletionException e) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof CitationRunAbortedException aborted) {
                throw aborted;
            }
            throw new CitationRunAbortedException("citation collection failed: " + cause.getMessage(), cause);
        }

        CitationSnapshot snapshot = new CitationSnapshot(citationsByPublication);
        log.info(
            "Collected citations for {} publications, {} distinct citing records",
            snapshot.publicationCount(),
            snapshot.citationCount()
        );
        return new CitationCollection(snapshot, List.copyOf(summaries));
    }

    PublicationResult collectOne(TrackedPublication publication) {
        String identifier = publication.identifier();
        log.info("Processing {}...", identifier);

        List<CitationRecord> raw = new ArrayList<>();
        Map<String, String> outcomes = new LinkedHashMap<>();
        for (CitationSourceAdapter adapter : adapters) {
            CitationBundle bundle = adapter.fetch(publication);
            if (Thread.currentThread().isInterrupted()) {
                throw new CitationRunAbortedException(
                    "citation collection interrupted during " + adapter.source().wireName() + " lookup for " + identifier
                );
            }
            outcomes.put(adapter.source().wireName(), bundle.describe());
            logOutcome(identifier, adapter, bundle);
            raw.addAll(bundle.citations());
        }

        List<CitationRecord> merged = merger.merge(raw);
        log.info("Found {} unique citing papers for {}", merged.size(), identifier);
        pauseBetweenPublications();
        return new PublicationResult(
            merged,
            new PublicationCitationSummary(identifier, outcomes, raw.size(), merged.size())
        );
    }

    private void logOutcome(String identifier, CitationSourceAdapter adapter, CitationBundle bundle) {
        if (bundle instanceof CitationBundle.Failed failed) {
            log.warn(
                "{} lookup for {} failed: reason={} retryable={} detail={}",
                adapter.source().wireName(),
                identifier,
                failed.reason(),
                ReasonCodeClassifier.isRetryable(failed.reason()),
                failed.detail()
            );
        } else if (bundle instanceof CitationBundle.NotFound) {
            log.info("{} has no record of {}", adapter.source().wireName(), identifier);
        } else {
            log.debug("{} returned {} citations for {}", adapter.source().wireName(), bundle.citations().size(), identifier);
        }
    }

    private void pauseBetweenPublications() {
        int delayMs = properties.getFetch().getInterPublicationDelayMs();
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CitationRunAbortedException("citation collection interrupted", e);
        }
    }

    record PublicationResult(List<CitationRecord> citations, PublicationCitationSummary summary) {
    }
}
