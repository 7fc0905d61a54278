package com.impact.tracker.citations.service;

import com.impact.tracker.citations.model.AggregationResult;
import com.impact.tracker.citations.model.CitationRecord;
import com.impact.tracker.citations.model.CitationSnapshot;
import com.impact.tracker.citations.model.DatedAggregation;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

import static com.impact.tracker.citations.model.CitationSource.OPENALEX;
import static com.impact.tracker.citations.model.CitationSource.SEMANTIC_SCHOLAR;
import static org.assertj.core.api.Assertions.assertThat;

class TemporalAggregatorTest {

    private final TemporalAggregator aggregator = new TemporalAggregator();

    @Test
    void countsPublicationsAndDistinctCitingDoisAsOfCutoff() {
        CitationSnapshot snapshot = new CitationSnapshot(Map.of(
            "10.1/a", List.of(
                new CitationRecord("X", "10.1/x", "2022-01-01", OPENALEX),
                new CitationRecord("Y", "10.1/y", "2023", SEMANTIC_SCHOLAR)
            )
        ));

        assertThat(aggregator.aggregate(LocalDate.of(2022, 12, 31), snapshot))
            .isEqualTo(new AggregationResult(1, 1));
        assertThat(aggregator.aggregate(LocalDate.of(2023, 6, 1), snapshot))
            .isEqualTo(new AggregationResult(1, 2));
        assertThat(aggregator.aggregate(LocalDate.of(2021, 12, 31), snapshot))
            .isEqualTo(new AggregationResult(0, 0));
    }

    @Test
    void yearOnlyAndFullDateOnJanuaryFirstCountTheSame() {
        CitationSnapshot yearOnly = snapshotOf("10.1/a", new CitationRecord("X", "10.1/x", "2021", OPENALEX));
        CitationSnapshot fullDate = snapshotOf("10.1/a", new CitationRecord("X", "10.1/x", "2021-01-01", OPENALEX));

        for (LocalDate cutoff : List.of(LocalDate.of(2020, 12, 31), LocalDate.of(2021, 1, 1))) {
            assertThat(aggregator.aggregate(cutoff, yearOnly)).isEqualTo(aggregator.aggregate(cutoff, fullDate));
        }
    }

    @Test
    void unparseableDatesNeverCount() {
        CitationSnapshot snapshot = snapshotOf(
            "10.1/a",
            new CitationRecord("X", "10.1/x", "2021-07", OPENALEX),
            new CitationRecord("Y", "10.1/y", null, OPENALEX)
        );

        assertThat(aggregator.aggregate(LocalDate.of(2030, 1, 1), snapshot))
            .isEqualTo(new AggregationResult(0, 0));
    }

    @Test
    void citationsWithoutDoiOnlyCountTowardsPublications() {
        CitationSnapshot snapshot = snapshotOf("Some title", new CitationRecord("Foo", null, "2021-05-05", OPENALEX));

        assertThat(aggregator.aggregate(LocalDate.of(2022, 1, 1), snapshot))
            .isEqualTo(new AggregationResult(1, 0));
    }

    @Test
    void citingDoiSharedByTwoPublicationsCountsOnce() {
        Map<String, List<CitationRecord>> citations = new LinkedHashMap<>();
        citations.put("10.1/a", List.of(new CitationRecord("X", "10.1/X", "2022-01-01", OPENALEX)));
        citations.put("10.1/b", List.of(new CitationRecord("X", "https://doi.org/10.1/x", "2022", SEMANTIC_SCHOLAR)));
        citations.put("10.1/c", List.of());

        assertThat(aggregator.aggregate(LocalDate.of(2022, 6, 1), new CitationSnapshot(citations)))
            .isEqualTo(new AggregationResult(2, 1));
    }

    @Test
    void emptySnapshotCountsNothing() {
        assertThat(aggregator.aggregate(LocalDate.of(2022, 6, 1), new CitationSnapshot(Map.of())))
            .isEqualTo(new AggregationResult(0, 0));
    }

    @Test
    void countsNeverDecreaseAsCutoffMovesLater() {
        Random random = new Random(42);
        Map<String, List<CitationRecord>> citations = new LinkedHashMap<>();
        for (int pub = 0; pub < 20; pub++) {
            List<CitationRecord> records = new ArrayList<>();
            int count = random.nextInt(6);
            for (int i = 0; i < count; i++) {
                String doi = random.nextBoolean() ? "10.9/" + random.nextInt(30) : null;
                String date = switch (random.nextInt(3)) {
                    case 0 -> Integer.toString(2015 + random.nextInt(10));
                    case 1 -> LocalDate.of(2015, 1, 1).plusDays(random.nextInt(3650)).toString();
                    default -> "2019-0" + (1 + random.nextInt(9));
                };
                records.add(new CitationRecord("Work " + i, doi, date, OPENALEX));
            }
            citations.put("pub-" + pub, records);
        }
        CitationSnapshot snapshot = new CitationSnapshot(citations);

        List<LocalDate> cutoffs = new ArrayList<>();
        for (LocalDate date = LocalDate.of(2014, 1, 1); date.isBefore(LocalDate.of(2026, 1, 1)); date = date.plusMonths(3)) {
            cutoffs.add(date);
        }
        List<DatedAggregation> results = aggregator.aggregateAll(cutoffs, snapshot);

        assertThat(results).hasSize(cutoffs.size());
        for (int i = 1; i < results.size(); i++) {
            AggregationResult previous = results.get(i - 1).result();
            AggregationResult current = results.get(i).result();
            assertThat(current.numOriginalPubs()).isGreaterThanOrEqualTo(previous.numOriginalPubs());
            assertThat(current.numCitingPubs()).isGreaterThanOrEqualTo(previous.numCitingPubs());
        }
    }

    private static CitationSnapshot snapshotOf(String identifier, CitationRecord... records) {
        return new CitationSnapshot(Map.of(identifier, List.of(records)));
    }
}
