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
import java.util.Map;

/**
 * Semantic Scholar graph API. Citation dates are reported at year precision,
 * which the aggregator reads as January 1st of that year.
 */
@Service
public class SemanticScholarCitationSource extends AbstractCitationSourceAdapter {
    private static final String PAPER_FIELDS = "paperId,title,externalIds,year";

    public SemanticScholarCitationSource(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        TrackerProperties properties
    ) {
        super(httpClient, objectMapper, properties);
    }

    @Override
    public CitationSource source() {
        return CitationSource.SEMANTIC_SCHOLAR;
    }

    @Override
    protected Map<String, String> extraHeaders() {
        String apiKey = properties.getSemanticScholar().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return Map.of();
        }
        return Map.of("x-api-key", apiKey.trim());
    }

    @Override
    protected CitationBundle lookupByDoi(String doi) {
        HttpFetchResult paper = getJson(baseUrl() + "/paper/DOI:" + encodePathSegment(doi) + "?fields=" + PAPER_FIELDS);
        if (paper.isNotFound()) {
            return new CitationBundle.NotFound("doi:" + doi);
        }
        if (!paper.isSuccessful()) {
            return failed(paper);
        }
        return citationsOf(readJson(paper));
    }

    @Override
    protected CitationBundle lookupByTitle(String title) {
        HttpFetchResult search = getJson(
            baseUrl() + "/paper/search?query=" + encode(title) + "&limit=1&fields=" + PAPER_FIELDS
        );
        if (search.isNotFound()) {
            return new CitationBundle.NotFound("title:" + title);
        }
        if (!search.isSuccessful()) {
            return failed(search);
        }
        JsonNode data = readJson(search).get("data");
        if (data == null || !data.isArray() || data.isEmpty()) {
            return new CitationBundle.NotFound("title:" + title);
        }
        return citationsOf(data.get(0));
    }

    private CitationBundle citationsOf(JsonNode paper) {
        String paperId = text(paper, "paperId");
        if (paperId == null || paperId.isBlank()) {
            throw new MalformedPayloadException("Semantic Scholar paper without paperId");
        }
        PublicationInfo info = new PublicationInfo(
            paperId,
            cleanTitle(text(paper, "title")),
            text(paper.get("externalIds"), "DOI"),
            text(paper, "year")
        );

        HttpFetchResult citing = getJson(
            baseUrl() + "/paper/" + encodePathSegment(paperId) + "/citations?fields=" + PAPER_FIELDS + "&limit=" + pageSize()
        );
        if (!citing.isSuccessful()) {
            return failed(citing);
        }
        JsonNode data = readJson(citing).get("data");
        List<CitationRecord> citations = new ArrayList<>();
        if (data != null && data.isArray()) {
            for (JsonNode entry : data) {
                JsonNode citingPaper = entry.get("citingPaper");
                if (citingPaper == null || !citingPaper.isObject()) {
                    continue;
                }
                citations.add(toRecord(
                    text(citingPaper, "title"),
                    text(citingPaper.get("externalIds"), "DOI"),
                    text(citingPaper, "year")
                ));
                if (citations.size() >= pageSize()) {
                    break;
                }
            }
        }
        return new CitationBundle.Found(info, citations);
    }

    private String baseUrl() {
        return properties.getSemanticScholar().getBaseUrl();
    }
}
