package com.impact.tracker.citations.service;

import com.impact.tracker.config.TrackerProperties;
import com.impact.tracker.citations.model.TrackedPublication;
import com.impact.tracker.citations.util.CitationKeys;
import com.impact.tracker.citations.util.DataPaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the tracked publication catalog. Accepts either
 * {@code {"publications": [{"title", "doi"}]}} or parallel
 * {@code {"dois": [], "titles": []}} lists.
 */
@Service
public class PublicationCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(PublicationCatalogLoader.class);

    private final TrackerProperties properties;
    private final ObjectMapper objectMapper;

    public PublicationCatalogLoader(TrackerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public List<TrackedPublication> load() {
        return load(DataPaths.resolve(properties.getData().getPublicationsFile()));
    }

    public List<TrackedPublication> load(Path catalogPath) {
        if (!Files.isRegularFile(catalogPath)) {
            throw new TrackerConfigurationException("publications file not found: " + catalogPath);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(catalogPath.toFile());
        } catch (IOException e) {
            throw new TrackerConfigurationException(
                "invalid JSON in " + catalogPath + ": " + DataPaths.rootMessage(e), e);
        }
        if (root == null || !root.isObject()) {
            throw new TrackerConfigurationException(catalogPath + " must contain a JSON object");
        }

        List<TrackedPublication> candidates;
        if (root.has("publications")) {
            candidates = fromEntries(root.get("publications"));
        } else if (root.has("dois") || root.has("titles")) {
            candidates = fromParallelLists(root.get("dois"), root.get("titles"));
        } else {
            throw new TrackerConfigurationException(catalogPath + " is missing the 'publications' key");
        }

        List<TrackedPublication> publications = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int position = 0;
        for (TrackedPublication candidate : candidates) {
            position++;
            if (!candidate.isProcessable()) {
                log.warn("Skipping catalog entry {}: neither DOI nor title", position);
                continue;
            }
            String identity = candidate.hasDoi()
                ? "doi:" + CitationKeys.doiKey(candidate.doi())
                : "title:" + candidate.title();
            if (!seen.add(identity)) {
                log.warn("Skipping duplicate catalog entry {} ({})", position, candidate.identifier());
                continue;
            }
            publications.add(candidate);
        }
        if (publications.isEmpty()) {
            throw new TrackerConfigurationException("no processable publications in " + catalogPath);
        }
        log.info("Loaded {} tracked publications from {}", publications.size(), catalogPath);
        return List.copyOf(publications);
    }

    private List<TrackedPublication> fromEntries(JsonNode entries) {
        if (entries == null || !entries.isArray()) {
            throw new TrackerConfigurationException("'publications' must be a JSON array");
        }
        List<TrackedPublication> out = new ArrayList<>();
        for (JsonNode entry : entries) {
            if (entry.isTextual()) {
                // bare strings are DOIs, as in older catalogs
                out.add(new TrackedPublication(null, entry.asText()));
            } else if (entry.isObject()) {
                out.add(new TrackedPublication(text(entry, "title"), text(entry, "doi")));
            } else {
                out.add(new TrackedPublication(null, null));
            }
        }
        return out;
    }

    private List<TrackedPublication> fromParallelLists(JsonNode dois, JsonNode titles) {
        if (dois == null || !dois.isArray() || titles == null || !titles.isArray()) {
            throw new TrackerConfigurationException("'dois' and 'titles' must both be JSON arrays");
        }
        if (dois.size() != titles.size()) {
            throw new TrackerConfigurationException(
                "publication list length mismatch: " + dois.size() + " DOIs vs " + titles.size() + " titles");
        }
        List<TrackedPublication> out = new ArrayList<>();
        for (int i = 0; i < dois.size(); i++) {
            out.add(new TrackedPublication(textValue(titles.get(i)), textValue(dois.get(i))));
        }
        return out;
    }

    private static String text(JsonNode node, String field) {
        return textValue(node.get(field));
    }

    private static String textValue(JsonNode value) {
        return (value == null || value.isNull()) ? null : value.asText();
    }
}
