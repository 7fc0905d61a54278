package com.impact.tracker.citations.source;

import com.impact.tracker.config.TrackerProperties;
import com.impact.tracker.citations.http.PoliteHttpClient;
import com.impact.tracker.citations.model.CitationBundle;
import com.impact.tracker.citations.model.CitationRecord;
import com.impact.tracker.citations.model.HttpFetchResult;
import com.impact.tracker.citations.util.CitationKeys;
import com.impact.tracker.citations.util.ReasonCodeClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Supplier;

abstract class AbstractCitationSourceAdapter implements CitationSourceAdapter {
    protected static final String ACCEPT_JSON = "application/json";

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final PoliteHttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final TrackerProperties properties;

    protected AbstractCitationSourceAdapter(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        TrackerProperties properties
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public CitationBundle fetchByDoi(String doi) {
        String bare = CitationKeys.bareDoi(doi);
        if (bare == null) {
            return new CitationBundle.Failed(ReasonCodeClassifier.INVALID_REQUEST, "blank DOI");
        }
        return guarded("doi " + bare, () -> lookupByDoi(bare));
    }

    @Override
    public CitationBundle fetchByTitle(String title) {
        if (title == null || title.isBlank()) {
            return new CitationBundle.Failed(ReasonCodeClassifier.INVALID_REQUEST, "blank title");
        }
        String trimmed = title.trim();
        return guarded("title '" + trimmed + "'", () -> lookupByTitle(trimmed));
    }

    protected abstract CitationBundle lookupByDoi(String doi);

    protected abstract CitationBundle lookupByTitle(String title);

    protected Map<String, String> extraHeaders() {
        return Map.of();
    }

    protected HttpFetchResult getJson(String url) {
        return httpClient.get(url, ACCEPT_JSON, extraHeaders());
    }

    protected CitationBundle.Failed failed(HttpFetchResult result) {
        String reason = ReasonCodeClassifier.fromFetchResult(result);
        String detail = result.errorMessage() != null
            ? result.errorMessage()
            : "HTTP " + result.statusCode() + " from " + result.requestedUrl();
        return new CitationBundle.Failed(reason, detail);
    }

    protected JsonNode readJson(HttpFetchResult result) {
        String body = result.body();
        if (body == null || body.isBlank()) {
            throw new MalformedPayloadException("empty body from " + result.requestedUrl());
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("invalid JSON from " + result.requestedUrl(), e);
        }
    }

    /**
     * Maps one provider entry into the common record shape. Entries that are not
     * JSON objects are skipped by callers.
     */
    protected CitationRecord toRecord(String rawTitle, String rawDoi, String rawDate) {
        return new CitationRecord(
            cleanTitle(rawTitle),
            CitationKeys.bareDoi(rawDoi),
            rawDate == null || rawDate.isBlank() ? null : rawDate.trim(),
            source()
        );
    }

    protected int pageSize() {
        return properties.getFetch().getMaxCitationsPerPublication();
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Percent-encodes a DOI for use inside a URL path. Slashes stay literal;
     * both providers expect {@code prefix/suffix} unescaped.
     */
    protected static String encodePathSegment(String value) {
        return encode(value).replace("+", "%20").replace("%2F", "/");
    }

    protected static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return (value == null || value.isNull()) ? null : value.asText();
    }

    static String cleanTitle(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        if (raw.indexOf('<') < 0) {
            return raw.trim();
        }
        return Jsoup.parse(raw).text().trim();
    }

    private CitationBundle guarded(String lookup, Supplier<CitationBundle> call) {
        try {
            CitationBundle bundle = call.get();
            log.debug("{} lookup by {} -> {}", source().wireName(), lookup, bundle.describe());
            return bundle;
        } catch (MalformedPayloadException e) {
            return new CitationBundle.Failed(ReasonCodeClassifier.PARSING_FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("{} lookup by {} failed unexpectedly", source().wireName(), lookup, e);
            return new CitationBundle.Failed(ReasonCodeClassifier.UNKNOWN, e.getMessage());
        }
    }

    static final class MalformedPayloadException extends RuntimeException {
        MalformedPayloadException(String message) {
            super(message);
        }

        MalformedPayloadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
