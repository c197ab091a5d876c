package io.quarkus.qe.perf.regression.detector.pushdate.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.qe.perf.regression.detector.configuration.AnalysisConfig;
import io.quarkus.qe.perf.regression.detector.logger.Logger;
import io.quarkus.qe.perf.regression.detector.pushdate.PushDateFetchException;
import io.quarkus.qe.perf.regression.detector.pushdate.PushDateResolver;
import io.quarkus.qe.perf.regression.detector.pushdate.PushLogClient;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Queries the {@code json-pushes} endpoint of a Mercurial push log.
 */
@Singleton
final class HttpPushLogClient implements PushLogClient {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final Logger logger;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String baseUrl;

    @Inject
    HttpPushLogClient(Logger logger, ObjectMapper objectMapper, AnalysisConfig config) {
        this(logger, objectMapper, config.baseHgUrl());
    }

    HttpPushLogClient(Logger logger, ObjectMapper objectMapper, String baseUrl) {
        this.logger = logger;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public Map<String, Long> fetchPushDates(String repoPath, List<String> revisions) {
        String query = revisions.stream()
                .map(revision -> "changeset=" + URLEncoder.encode(revision, StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        URI uri = URI.create(baseUrl + "/" + repoPath + "/json-pushes?" + query);

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PushDateFetchException("Failed to query " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PushDateFetchException("Interrupted while querying " + uri, e);
        }
        if (response.statusCode() != 200) {
            throw new PushDateFetchException("Push log " + uri + " answered HTTP " + response.statusCode());
        }
        return parse(response.body());
    }

    /**
     * Parse a {@code json-pushes} response: push id to {@code {"date": ..., "changesets": [...]}}.
     * Any other valid JSON, e.g. an error message, contains no push dates.
     */
    Map<String, Long> parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.error("Error parsing " + body);
            throw new PushDateFetchException("Malformed push log response", e);
        }

        Map<String, Long> dates = new HashMap<>();
        if (root == null || !root.isObject()) {
            return dates;
        }
        for (JsonNode push : root) {
            JsonNode date = push.get("date");
            JsonNode changesets = push.get("changesets");
            if (date == null || !date.isNumber() || changesets == null || !changesets.isArray()) {
                logger.error("Error parsing " + body);
                throw new PushDateFetchException("Malformed push entry: " + push);
            }
            for (JsonNode changeset : changesets) {
                dates.put(PushDateResolver.shortRevision(changeset.asText()), date.asLong());
            }
        }
        return dates;
    }
}
