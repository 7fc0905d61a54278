package com.impact.tracker.citations.source;

import com.impact.tracker.config.TrackerProperties;
import com.impact.tracker.citations.http.PoliteHttpClient;
import com.impact.tracker.citations.model.CitationBundle;
import com.impact.tracker.citations.model.CitationRecord;
import com.impact.tracker.citations.model.CitationSource;
import com.impact.tracker.citations.model.HttpFetchResult;
import com.impact.tracker.citations.model.PublicationInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAlex works API. Publications are resolved to a work id first, then the
 * citing works are listed with the {@code cites:} filter.
 */
@Service
public class OpenAlexCitationSource extends AbstractCitationSourceAdapter {

    public OpenAlexCitationSource(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        TrackerProperties properties
    ) {
        super(httpClient, objectMapper, properties);
    }

    @Override
    public CitationSource source() {
        return CitationSource.OPENALEX;
    }

    @Override
    protected CitationBundle lookupByDoi(String doi) {
        HttpFetchResult direct = getJson(withMailto(baseUrl() + "/works/doi:" + encodePathSegment(doi)));
        if (direct.isSuccessful()) {
            return citationsOf(readJson(direct));
        }
        if (!direct.isNotFound()) {
            return failed(direct);
        }

        // direct lookup misses some DOIs the filter endpoint still knows
        HttpFetchResult search = getJson(withMailto(baseUrl() + "/works?filter=doi:" + encode(doi) + "&per-page=1"));
        return firstResult(search, "doi:" + doi);
    }

    @Override
    protected CitationBundle lookupByTitle(String title) {
        HttpFetchResult search = getJson(withMailto(baseUrl() + "/works?search=" + encode(title) + "&per-page=1"));
        return firstResult(search, "title:" + title);
    }

    private CitationBundle firstResult(HttpFetchResult search, String lookup) {
        if (search.isNotFound()) {
            return new CitationBundle.NotFound(lookup);
        }
        if (!search.isSuccessful()) {
            return failed(search);
        }
        JsonNode results = readJson(search).get("results");
        if (results == null || !results.isArray() || results.isEmpty()) {
            return new CitationBundle.NotFound(lookup);
        }
        return citationsOf(results.get(0));
    }

    private CitationBundle citationsOf(JsonNode work) {
        String workId = shortWorkId(text(work, "id"));
        if (workId == null) {
            throw new MalformedPayloadException("OpenAlex work without id");
        }
        PublicationInfo info = new PublicationInfo(
            workId,
            cleanTitle(text(work, "title")),
            text(work, "doi"),
            text(work, "publication_date")
        );

        HttpFetchResult citing = getJson(withMailto(
            baseUrl() + "/works?filter=cites:" + workId + "&per-page=" + pageSize()
        ));
        if (!citing.isSuccessful()) {
            return failed(citing);
        }
        JsonNode results = readJson(citing).get("results");
        List<CitationRecord> citations = new ArrayList<>();
        if (results != null && results.isArray()) {
            for (JsonNode entry : results) {
                if (!entry.isObject()) {
                    continue;
                }
                citations.add(toRecord(text(entry, "title"), text(entry, "doi"), text(entry, "publication_date")));
                if (citations.size() >= pageSize()) {
                    break;
                }
            }
        }
        return new CitationBundle.Found(info, citations);
    }

    private String baseUrl() {
        return properties.getOpenAlex().getBaseUrl();
    }

    private String withMailto(String url) {
        String mailto = properties.getOpenAlex().getMailto();
        if (mailto == null || mailto.isBlank()) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + "mailto=" + encode(mailto.trim());
    }

    static String shortWorkId(String idUrl) {
        if (idUrl == null || idUrl.isBlank()) {
            return null;
        }
        int idx = idUrl.lastIndexOf('/');
        String id = idx >= 0 ? idUrl.substring(idx + 1) : idUrl;
        return id.isBlank() ? null : id;
    }
}
