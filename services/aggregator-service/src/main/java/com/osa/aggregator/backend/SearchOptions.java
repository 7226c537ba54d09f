package com.osa.aggregator.backend;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SearchOptions {
    @JsonProperty("max_results")
    private Integer maxResults;

    @JsonProperty("max_sources")
    private Integer maxSources;

    private List<String> sources;
    private String language;

    @JsonProperty("time_range")
    private String timeRange;

    @JsonProperty("timeout_ms")
    private Integer timeoutMs;

    private Integer priority;

    public static SearchOptions defaults() {
        return new SearchOptions();
    }

    public Integer getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(Integer maxResults) {
        this.maxResults = maxResults;
    }

    public Integer getMaxSources() {
        return maxSources;
    }

    public void setMaxSources(Integer maxSources) {
        this.maxSources = maxSources;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getTimeRange() {
        return timeRange;
    }

    public void setTimeRange(String timeRange) {
        this.timeRange = timeRange;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Integer timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public Integer getPriority() {
        return priority;
    }

    public void setPriority(Integer priority) {
        this.priority = priority;
    }
}
