package com.osa.aggregator.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackendHealth {
    @JsonProperty("backend_id")
    private final String backendId;

    private final HealthState state;

    @JsonProperty("consecutive_error_count")
    private final int consecutiveErrorCount;

    @JsonProperty("success_count")
    private final int successCount;

    @JsonProperty("error_count")
    private final int errorCount;

    @JsonProperty("total_requests")
    private final long totalRequests;

    @JsonProperty("error_rate")
    private final double errorRate;

    @JsonProperty("average_response_time_ms")
    private final double averageResponseTimeMs;

    @JsonProperty("last_error_at")
    private final Long lastErrorAt;

    @JsonProperty("last_success_at")
    private final Long lastSuccessAt;

    @JsonProperty("last_error_message")
    private final String lastErrorMessage;

    public BackendHealth(
        String backendId,
        HealthState state,
        int consecutiveErrorCount,
        int successCount,
        int errorCount,
        long totalRequests,
        double errorRate,
        double averageResponseTimeMs,
        Long lastErrorAt,
        Long lastSuccessAt,
        String lastErrorMessage
    ) {
        this.backendId = backendId;
        this.state = state;
        this.consecutiveErrorCount = consecutiveErrorCount;
        this.successCount = successCount;
        this.errorCount = errorCount;
        this.totalRequests = totalRequests;
        this.errorRate = errorRate;
        this.averageResponseTimeMs = averageResponseTimeMs;
        this.lastErrorAt = lastErrorAt;
        this.lastSuccessAt = lastSuccessAt;
        this.lastErrorMessage = lastErrorMessage;
    }

    public String getBackendId() {
        return backendId;
    }

    public HealthState getState() {
        return state;
    }

    public int getConsecutiveErrorCount() {
        return consecutiveErrorCount;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public long getTotalRequests() {
        return totalRequests;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public double getAverageResponseTimeMs() {
        return averageResponseTimeMs;
    }

    public Long getLastErrorAt() {
        return lastErrorAt;
    }

    public Long getLastSuccessAt() {
        return lastSuccessAt;
    }

    public String getLastErrorMessage() {
        return lastErrorMessage;
    }
}
