package com.impact.tracker.citations.persistence;

import com.impact.tracker.config.TrackerProperties;
import com.impact.tracker.citations.model.CitationRecord;
import com.impact.tracker.citations.model.CitationSnapshot;
import com.impact.tracker.citations.util.DataPaths;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * JSON file holding the last completed snapshot: publication identifier to its
 * deduplicated citations. Writes replace the whole file through a temporary
 * sibling so readers never see a partial snapshot. Single writer only.
 */
@Repository
public class CitationSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(CitationSnapshotStore.class);
    private static final TypeReference<LinkedHashMap<String, List<CitationRecord>>> SNAPSHOT_TYPE =
        new TypeReference<>() {
        };

    private final ObjectMapper objectMapper;
    private final Path snapshotPath;

    @Autowired
    public CitationSnapshotStore(TrackerProperties properties, ObjectMapper objectMapper) {
        this(DataPaths.resolve(properties.getData().getSnapshotFile()), objectMapper);
    }

    CitationSnapshotStore(Path snapshotPath, ObjectMapper objectMapper) {
        this.snapshotPath = snapshotPath;
        this.objectMapper = objectMapper;
    }

    public Path location() {
        return snapshotPath;
    }

    public void write(CitationSnapshot snapshot) {
        Path tempFile = null;
        try {
            Path directory = snapshotPath.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, snapshotPath.getFileName().toString(), ".tmp");
            byte[] json = objectMapper.writer(SerializationFeature.INDENT_OUTPUT)
                .writeValueAsBytes(snapshot.citationsByPublication());
            Files.write(tempFile, json);
            moveIntoPlace(tempFile);
            log.info(
                "Wrote citation snapshot with {} publications and {} citations to {}",
                snapshot.publicationCount(),
                snapshot.citationCount(),
                snapshotPath
            );
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new SnapshotStoreException("failed to write snapshot " + snapshotPath, e);
        }
    }

    public Optional<CitationSnapshot> read() {
        if (!Files.exists(snapshotPath)) {
            return Optional.empty();
        }
        LinkedHashMap<String, List<CitationRecord>> citations;
        try {
            citations = objectMapper.readValue(snapshotPath.toFile(), SNAPSHOT_TYPE);
        } catch (IOException | RuntimeException e) {
            throw new SnapshotStoreException("failed to read snapshot " + snapshotPath, e);
        }
        if (citations == null) {
            throw new SnapshotStoreException("snapshot " + snapshotPath + " is not a JSON object");
        }
        citations.forEach(this::validateEntry);
        return Optional.of(new CitationSnapshot(citations));
    }

    public CitationSnapshot require() {
        return read().orElseThrow(() ->
            new SnapshotNotFoundException("no citation snapshot at " + snapshotPath + "; run a collection first"));
    }

    private void validateEntry(String identifier, List<CitationRecord> citations) {
        if (citations == null) {
            return;
        }
        for (CitationRecord citation : citations) {
            if (citation == null) {
                throw new SnapshotStoreException(
                    "snapshot " + snapshotPath + " has a null citation under " + identifier);
            }
            if (citation.source() == null) {
                throw new SnapshotStoreException(
                    "snapshot " + snapshotPath + " has a citation without source under " + identifier);
            }
        }
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove temporary snapshot file {}", file, e);
        }
    }
}
