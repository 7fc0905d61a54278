package com.impact.tracker.citations.service;

import com.impact.tracker.config.TrackerProperties;
import com.impact.tracker.citations.model.CitationRunRequest;
import com.impact.tracker.citations.model.CitationRunSummary;
import com.impact.tracker.citations.model.PublicationCitationSummary;
import com.impact.tracker.citations.persistence.SnapshotNotFoundException;
import com.impact.tracker.citations.persistence.SnapshotStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;

@Component
public class CitationCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CitationCliRunner.class);

    private final TrackerProperties properties;
    private final CitationRunService citationRunService;
    private final ConfigurableApplicationContext applicationContext;

    public CitationCliRunner(
        TrackerProperties properties,
        CitationRunService citationRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.citationRunService = citationRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode = execute();
        if (properties.getCli().isExitAfterRun()) {
            System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
        }
    }

    int execute() {
        try {
            CitationRunRequest request = new CitationRunRequest(
                parseCutoffDates(properties.getCli().getCutoffDates()),
                properties.getCli().isWriteReport()
            );
            CitationRunSummary summary = properties.getCli().isReaggregateOnly()
                ? citationRunService.reaggregateAndReport(request)
                : citationRunService.run(request);
            logSummary(summary);
            return 0;
        } catch (TrackerConfigurationException e) {
            log.error("Citation run aborted, configuration is invalid: {}", e.getMessage());
        } catch (SnapshotNotFoundException e) {
            log.error("Re-aggregation aborted: {}", e.getMessage());
        } catch (CitationRunAbortedException e) {
            log.error("Citation run aborted before the snapshot was written: {}", e.getMessage());
        } catch (SnapshotStoreException e) {
            log.error("Citation snapshot unusable: {}", e.getMessage(), e);
        } catch (UncheckedIOException e) {
            log.error("Report sheet could not be updated: {}", e.getMessage(), e);
        }
        return 1;
    }

    static List<LocalDate> parseCutoffDates(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .map(LocalDate::parse)
                .toList();
        } catch (DateTimeParseException e) {
            throw new TrackerConfigurationException("tracker.cli.cutoff-dates must be ISO dates: " + raw, e);
        }
    }

    private void logSummary(CitationRunSummary summary) {
        log.info(
            "Citation run complete: publications={}, citations={}, snapshot={}, reportWritten={}",
            summary.publicationsProcessed(),
            summary.citationsMerged(),
            summary.snapshotPath(),
            summary.reportWritten()
        );
        for (PublicationCitationSummary publication : summary.publications()) {
            log.info(
                "Summary {}: sources={}, raw={}, merged={}",
                publication.identifier(),
                publication.sourceOutcomes(),
                publication.rawCitationsCount(),
                publication.mergedCitationsCount()
            );
        }
    }
}
