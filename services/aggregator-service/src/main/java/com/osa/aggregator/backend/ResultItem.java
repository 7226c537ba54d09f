package com.osa.aggregator.backend;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A normalized search hit. The url is the deduplication key across backends.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultItem {
    private final String url;
    private final String title;
    private final String snippet;

    @JsonProperty("source_backend_id")
    private final String sourceBackendId;

    @JsonProperty("relevance_score")
    private final double relevanceScore;

    @JsonProperty("published_date")
    private final String publishedDate;

    @JsonProperty("raw_payload")
    private final Map<String, Object> rawPayload;

    @JsonProperty("aggregation_metadata")
    private final AggregationMetadata aggregationMetadata;

    public ResultItem(String url, String title, String sourceBackendId, double relevanceScore) {
        this(url, title, null, sourceBackendId, relevanceScore, null, null, null);
    }

    public ResultItem(
        String url,
        String title,
        String snippet,
        String sourceBackendId,
        double relevanceScore,
        String publishedDate,
        Map<String, Object> rawPayload,
        AggregationMetadata aggregationMetadata
    ) {
        this.url = url;
        this.title = title;
        this.snippet = snippet;
        this.sourceBackendId = sourceBackendId;
        this.relevanceScore = relevanceScore;
        this.publishedDate = publishedDate;
        this.rawPayload = rawPayload == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(rawPayload));
        this.aggregationMetadata = aggregationMetadata;
    }

    public ResultItem withAggregationMetadata(AggregationMetadata metadata) {
        return new ResultItem(url, title, snippet, sourceBackendId, relevanceScore, publishedDate, rawPayload, metadata);
    }

    public String getUrl() {
        return url;
    }

    public String getTitle() {
        return title;
    }

    public String getSnippet() {
        return snippet;
    }

    public String getSourceBackendId() {
        return sourceBackendId;
    }

    public double getRelevanceScore() {
        return relevanceScore;
    }

    public String getPublishedDate() {
        return publishedDate;
    }

    public Map<String, Object> getRawPayload() {
        return rawPayload;
    }

    public AggregationMetadata getAggregationMetadata() {
        return aggregationMetadata;
    }
}
