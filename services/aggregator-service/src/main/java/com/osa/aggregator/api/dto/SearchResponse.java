package com.osa.aggregator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.osa.aggregator.backend.ResultItem;
import com.osa.aggregator.service.BackendOutcome;
import java.util.List;

public class SearchResponse {
    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("took_ms")
    private long tookMs;

    private boolean partial;
    private boolean cached;
    private List<ResultItem> hits;
    private List<BackendOutcome> backends;

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public boolean isPartial() {
        return partial;
    }

    public void setPartial(boolean partial) {
        this.partial = partial;
    }

    public boolean isCached() {
        return cached;
    }

    public void setCached(boolean cached) {
        this.cached = cached;
    }

    public List<ResultItem> getHits() {
        return hits;
    }

    public void setHits(List<ResultItem> hits) {
        this.hits = hits;
    }

    public List<BackendOutcome> getBackends() {
        return backends;
    }

    public void setBackends(List<BackendOutcome> backends) {
        this.backends = backends;
    }
}
