package com.osa.aggregator.backend;

import com.fasterxml.jackson.annotation.JsonProperty;

public class AggregationMetadata {
    private final String query;

    @JsonProperty("aggregated_at")
    private final String aggregatedAt;

    @JsonProperty("source_backend_id")
    private final String sourceBackendId;

    public AggregationMetadata(String query, String aggregatedAt, String sourceBackendId) {
        this.query = query;
        this.aggregatedAt = aggregatedAt;
        this.sourceBackendId = sourceBackendId;
    }

    public String getQuery() {
        return query;
    }

    public String getAggregatedAt() {
        return aggregatedAt;
    }

    public String getSourceBackendId() {
        return sourceBackendId;
    }
}
