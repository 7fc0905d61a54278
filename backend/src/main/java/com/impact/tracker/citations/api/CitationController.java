package com.impact.tracker.citations.api;

import com.impact.tracker.citations.model.CitationRecord;
import com.impact.tracker.citations.model.CitationRunRequest;
import com.impact.tracker.citations.model.CitationRunSummary;
import com.impact.tracker.citations.model.DatedAggregation;
import com.impact.tracker.citations.persistence.CitationSnapshotStore;
import com.impact.tracker.citations.service.CitationRunService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/citations")
public class CitationController {
    private final CitationRunService citationRunService;
    private final CitationSnapshotStore snapshotStore;

    public CitationController(CitationRunService citationRunService, CitationSnapshotStore snapshotStore) {
        this.citationRunService = citationRunService;
        this.snapshotStore = snapshotStore;
    }

    @PostMapping("/run")
    public CitationRunSummary run(@RequestBody(required = false) CitationApiRunRequest request) {
        CitationRunRequest runRequest = new CitationRunRequest(
            parseDates(request == null ? null : request.cutoffDates()),
            request == null ? null : request.writeReport()
        );
        return citationRunService.run(runRequest);
    }

    @GetMapping("/aggregate")
    public List<DatedAggregation> aggregate(@RequestParam(name = "cutoff") List<String> cutoffs) {
        List<LocalDate> dates = parseDates(cutoffs);
        if (dates.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "at least one cutoff date is required");
        }
        return citationRunService.reaggregate(dates);
    }

    @GetMapping("/snapshot")
    public Map<String, List<CitationRecord>> snapshot() {
        return snapshotStore.require().citationsByPublication();
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return Map.of(
            "running", citationRunService.isRunning(),
            "snapshotPath", snapshotStore.location().toString()
        );
    }

    private List<LocalDate> parseDates(List<String> raw) {
        List<LocalDate> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String value : raw) {
            if (value == null || value.isBlank()) {
                continue;
            }
            try {
                out.add(LocalDate.parse(value.trim()));
            } catch (DateTimeParseException e) {
                throw new ResponseStatusException(BAD_REQUEST, "Invalid date (expected YYYY-MM-DD): " + value);
            }
        }
        return out;
    }
}
