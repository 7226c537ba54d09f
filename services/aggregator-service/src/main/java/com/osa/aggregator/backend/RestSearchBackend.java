package com.osa.aggregator.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Client for backends that already answer in the normalized result shape:
 * {@code {"results":[{"url":..,"title":..,"snippet":..,"score":..}]}}.
 */
public class RestSearchBackend implements SearchBackend {
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final String id;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String path;

    public RestSearchBackend(String id, RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, String path) {
        this.id = id;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.path = path == null ? "" : path;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<ResultItem> search(String query, SearchOptions options) {
        URI url = buildUri(query, options);
        JsonNode root;
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.GET, HttpEntity.EMPTY, String.class);
            root = objectMapper.readTree(response.getBody() == null ? "" : response.getBody());
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new BackendException(id, BackendErrorKind.TIMEOUT, null, "Backend read timeout: " + id, e);
            }
            throw new BackendException(id, BackendErrorKind.NETWORK, null, "Backend unreachable: " + id, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 429) {
                throw new BackendException(id, BackendErrorKind.RATE_LIMITED, status, "Backend rate limited: " + id, e);
            }
            throw new BackendException(id, BackendErrorKind.HTTP_ERROR, status, "Backend error: " + status, e);
        } catch (JsonProcessingException e) {
            throw new BackendException(id, BackendErrorKind.INVALID_RESPONSE, null, "Failed to parse backend response", e);
        }
        return parseResults(root);
    }

    private List<ResultItem> parseResults(JsonNode root) {
        JsonNode results = root == null ? null : root.path("results");
        if (results == null || !results.isArray()) {
            throw new BackendException(id, BackendErrorKind.INVALID_RESPONSE, "Backend response has no results array");
        }
        List<ResultItem> items = new ArrayList<>(results.size());
        for (JsonNode node : results) {
            String itemUrl = node.path("url").asText(null);
            if (itemUrl == null || itemUrl.isBlank()) {
                continue;
            }
            items.add(
                new ResultItem(
                    itemUrl,
                    node.path("title").asText(null),
                    node.path("snippet").asText(null),
                    id,
                    node.path("score").asDouble(0.0),
                    node.path("published_date").asText(null),
                    objectMapper.convertValue(node, PAYLOAD_TYPE),
                    null
                )
            );
        }
        return items;
    }

    private URI buildUri(String query, SearchOptions options) {
        String base = baseUrl;
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(base + path).queryParam("q", query);
        if (options != null) {
            if (options.getMaxResults() != null) {
                builder.queryParam("limit", options.getMaxResults());
            }
            if (options.getLanguage() != null) {
                builder.queryParam("lang", options.getLanguage());
            }
            if (options.getTimeRange() != null) {
                builder.queryParam("time_range", options.getTimeRange());
            }
        }
        return builder.encode().build().toUri();
    }
}
