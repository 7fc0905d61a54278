package com.impact.tracker.citations.persistence;

import com.impact.tracker.citations.model.CitationRecord;
import com.impact.tracker.citations.model.CitationSnapshot;
import com.impact.tracker.config.TrackerConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static com.impact.tracker.citations.model.CitationSource.OPENALEX;
import static com.impact.tracker.citations.model.CitationSource.SEMANTIC_SCHOLAR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CitationSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new TrackerConfig().objectMapper();

    @Test
    void writesSnapshotInWireShapeAndReadsItBackInOrder() throws Exception {
        Path file = tempDir.resolve("nested/snapshot.json");
        CitationSnapshotStore store = new CitationSnapshotStore(file, objectMapper);
        Map<String, List<CitationRecord>> citations = new LinkedHashMap<>();
        citations.put("10.1/b", List.of(new CitationRecord("Y", "10.1/y", "2023", SEMANTIC_SCHOLAR)));
        citations.put("10.1/a", List.of(
            new CitationRecord("X", "10.1/x", "2022-01-01", OPENALEX),
            new CitationRecord("Foo", null, null, OPENALEX)
        ));
        citations.put("Some title", List.of());

        store.write(new CitationSnapshot(citations));

        JsonNode written = objectMapper.readTree(file.toFile());
        JsonNode first = written.get("10.1/a").get(0);
        assertThat(first.get("publication_date").asText()).isEqualTo("2022-01-01");
        assertThat(first.get("source").asText()).isEqualTo("openalex");
        assertThat(written.get("10.1/a").get(1).get("doi").isNull()).isTrue();

        CitationSnapshot read = store.read().orElseThrow();
        assertThat(read.citationsByPublication()).containsExactlyEntriesOf(citations);
        assertThat(read.citationsByPublication().keySet()).containsExactly("10.1/b", "10.1/a", "Some title");
    }

    @Test
    void newSnapshotReplacesPreviousOneEntirely() throws Exception {
        Path file = tempDir.resolve("snapshot.json");
        CitationSnapshotStore store = new CitationSnapshotStore(file, objectMapper);
        store.write(new CitationSnapshot(Map.of(
            "10.1/old", List.of(new CitationRecord("Old", "10.1/o", "2020", OPENALEX)))));

        store.write(new CitationSnapshot(Map.of("10.1/new", List.of())));

        assertThat(store.require().citationsByPublication()).containsOnlyKeys("10.1/new");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void missingSnapshotIsEmptyAndRequireFails() {
        CitationSnapshotStore store = new CitationSnapshotStore(tempDir.resolve("absent.json"), objectMapper);

        assertThat(store.read()).isEmpty();
        assertThatThrownBy(store::require)
            .isInstanceOf(SnapshotNotFoundException.class)
            .hasMessageContaining("absent.json");
    }

    @Test
    void corruptOrUnknownContentIsRejected() throws Exception {
        Path corrupt = tempDir.resolve("corrupt.json");
        Files.writeString(corrupt, "{\"10.1/a\": [", StandardCharsets.UTF_8);
        Path unknownSource = tempDir.resolve("unknown.json");
        Files.writeString(
            unknownSource,
            "{\"10.1/a\":[{\"title\":\"X\",\"doi\":null,\"publication_date\":\"2022\",\"source\":\"crossref\"}]}",
            StandardCharsets.UTF_8
        );

        assertThatThrownBy(() -> new CitationSnapshotStore(corrupt, objectMapper).read())
            .isInstanceOf(SnapshotStoreException.class);
        assertThatThrownBy(() -> new CitationSnapshotStore(unknownSource, objectMapper).read())
            .isInstanceOf(SnapshotStoreException.class);
    }

    @Test
    void nullCitationOrMissingSourceFailsTheRead() throws Exception {
        Path nullCitation = tempDir.resolve("null-citation.json");
        Files.writeString(nullCitation, "{\"10.1/a\": [null]}", StandardCharsets.UTF_8);
        Path nullSource = tempDir.resolve("null-source.json");
        Files.writeString(
            nullSource,
            "{\"10.1/a\":[{\"title\":\"X\",\"doi\":\"10.1/x\",\"publication_date\":\"2022\",\"source\":null}]}",
            StandardCharsets.UTF_8
        );
        Path notAnObject = tempDir.resolve("null.json");
        Files.writeString(notAnObject, "null", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new CitationSnapshotStore(nullCitation, objectMapper).read())
            .isInstanceOf(SnapshotStoreException.class)
            .hasMessageContaining("10.1/a");
        assertThatThrownBy(() -> new CitationSnapshotStore(nullSource, objectMapper).require())
            .isInstanceOf(SnapshotStoreException.class);
        assertThatThrownBy(() -> new CitationSnapshotStore(notAnObject, objectMapper).read())
            .isInstanceOf(SnapshotStoreException.class);
    }
}
