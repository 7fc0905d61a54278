package com.impact.tracker.citations.service;

import com.impact.tracker.citations.model.CitationCollection;
import com.impact.tracker.citations.model.CitationRunRequest;
import com.impact.tracker.citations.model.CitationRunSummary;
import com.impact.tracker.citations.model.CitationSnapshot;
import com.impact.tracker.citations.model.DatedAggregation;
import com.impact.tracker.citations.model.TrackedPublication;
import com.impact.tracker.citations.persistence.CitationSnapshotStore;
import com.impact.tracker.citations.report.ImpactReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One citation run: load the catalog, fetch and merge, persist the snapshot,
 * then aggregate per cutoff date and report. The snapshot is only written once
 * the merge phase has completed for every publication.
 */
@Service
public class CitationRunService {
    private static final Logger log = LoggerFactory.getLogger(CitationRunService.class);

    private final PublicationCatalogLoader catalogLoader;
    private final CitationCollectionService collectionService;
    private final CitationSnapshotStore snapshotStore;
    private final TemporalAggregator aggregator;
    private final ImpactReportSink reportSink;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CitationRunService(
        PublicationCatalogLoader catalogLoader,
        CitationCollectionService collectionService,
        CitationSnapshotStore snapshotStore,
        TemporalAggregator aggregator,
        ImpactReportSink reportSink
    ) {
        this.catalogLoader = catalogLoader;
        this.collectionService = collectionService;
        this.snapshotStore = snapshotStore;
        this.aggregator = aggregator;
        this.reportSink = reportSink;
    }

    public CitationRunSummary run(CitationRunRequest request) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveCitationRunException("a citation run is already in progress");
        }
        try {
            return runExclusive(request == null ? new CitationRunRequest(null, null) : request);
        } finally {
            running.set(false);
        }
    }

    /**
     * Aggregates the stored snapshot without contacting any provider.
     */
    public List<DatedAggregation> reaggregate(List<LocalDate> cutoffDates) {
        CitationSnapshot snapshot = snapshotStore.require();
        List<DatedAggregation> aggregations = aggregator.aggregateAll(cutoffDates, snapshot);
        aggregations.forEach(this::logAggregation);
        return aggregations;
    }

    public CitationRunSummary reaggregateAndReport(CitationRunRequest request) {
        CitationRunRequest effective = request == null ? new CitationRunRequest(null, null) : request;
        Instant startedAt = Instant.now();
        CitationSnapshot snapshot = snapshotStore.require();
        List<LocalDate> cutoffDates = resolveCutoffDates(effective);
        List<DatedAggregation> aggregations = aggregator.aggregateAll(cutoffDates, snapshot);
        aggregations.forEach(this::logAggregation);
        boolean reportWritten = report(effective, aggregations);
        return new CitationRunSummary(
            startedAt,
            Instant.now(),
            snapshot.publicationCount(),
            snapshot.citationCount(),
            snapshotStore.location().toString(),
            reportWritten,
            List.of(),
            aggregations
        );
    }

    public boolean isRunning() {
        return running.get();
    }

    private CitationRunSummary runExclusive(CitationRunRequest request) {
        Instant startedAt = Instant.now();
        List<TrackedPublication> publications = catalogLoader.load();
        List<LocalDate> cutoffDates = resolveCutoffDates(request);
        log.info("Citation run started for {} publications, {} cutoff dates", publications.size(), cutoffDates.size());

        CitationCollection collection = collectionService.collect(publications);
        snapshotStore.write(collection.snapshot());

        List<DatedAggregation> aggregations = aggregator.aggregateAll(cutoffDates, collection.snapshot());
        aggregations.forEach(this::logAggregation);
        boolean reportWritten = report(request, aggregations);

        Instant finishedAt = Instant.now();
        log.info("Citation run finished in {} ms", finishedAt.toEpochMilli() - startedAt.toEpochMilli());
        return new CitationRunSummary(
            startedAt,
            finishedAt,
            collection.snapshot().publicationCount(),
            collection.snapshot().citationCount(),
            snapshotStore.location().toString(),
            reportWritten,
            collection.publications(),
            aggregations
        );
    }

    private List<LocalDate> resolveCutoffDates(CitationRunRequest request) {
        List<LocalDate> requested = request.normalizedCutoffDates();
        if (!requested.isEmpty()) {
            return requested;
        }
        List<LocalDate> pending = reportSink.pendingCutoffDates(LocalDate.now(ZoneOffset.UTC));
        if (pending.isEmpty()) {
            log.info("No pending report dates, all columns filled");
        } else {
            log.info("Found {} pending report dates: {}", pending.size(), pending);
        }
        return pending;
    }

    private boolean report(CitationRunRequest request, List<DatedAggregation> aggregations) {
        if (!request.shouldWriteReport() || aggregations.isEmpty()) {
            return false;
        }
        reportSink.record(aggregations);
        return true;
    }

    private void logAggregation(DatedAggregation aggregation) {
        log.info(
            "As of {}: num_original_pubs={}, num_citing_pubs={}",
            aggregation.cutoffDate(),
            aggregation.result().numOriginalPubs(),
            aggregation.result().numCitingPubs()
        );
    }
}
