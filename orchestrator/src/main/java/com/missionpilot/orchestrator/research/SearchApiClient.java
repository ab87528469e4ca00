package com.missionpilot.orchestrator.research;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * HTTP client for a SearxNG-compatible JSON search endpoint.
 *
 * GET {base-url}/search?q=...&format=json
 *   → { "results": [ { "title", "url", "content" }, ... ] }
 *
 * Uses java.net.http.HttpClient, same as the Claude client, so every header
 * and byte on the wire is explicit.
 */
@Component
public class SearchApiClient implements ResearchCollaborator {

    private static final Logger log = LoggerFactory.getLogger(SearchApiClient.class);

    private static final int MAX_RESULTS = 8;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<Result> results) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Result(String title, String url, String content) {}
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public SearchApiClient(@Value("${missionpilot.research.base-url}") String baseUrl,
                           ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public List<Finding> research(String query) {
        log.info("Researching: {}", query);
        String uri = baseUrl + "/search?format=json&q=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(uri))
                    .timeout(Duration.ofSeconds(30))
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ResearchException("Search failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            SearchResponse parsed = json.readValue(resp.body(), SearchResponse.class);
            if (parsed.results() == null) {
                return List.of();
            }
            return parsed.results().stream()
                    .filter(Objects::nonNull)
                    .filter(r -> r.title() != null || r.content() != null)
                    .limit(MAX_RESULTS)
                    .map(r -> new Finding(r.title(), r.url(), r.content()))
                    .toList();
        } catch (ResearchException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResearchException("Search interrupted", e);
        } catch (Exception e) {
            throw new ResearchException("Search failed for query '" + query + "'", e);
        }
    }
}
