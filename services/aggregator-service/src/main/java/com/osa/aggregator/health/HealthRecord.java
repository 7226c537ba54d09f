package com.osa.aggregator.health;

/**
 * Rolling counters for one backend. The state is always derived from the
 * counters; callers hold this record's monitor while mutating it.
 */
class HealthRecord {
    private static final double DECAY = 0.8;
    private static final double RESPONSE_TIME_ALPHA = 0.1;

    private final String backendId;
    private int consecutiveErrorCount;
    private int successCount;
    private int errorCount;
    private long totalRequests;
    private long windowStart;
    private Long lastErrorAt;
    private Long lastSuccessAt;
    private String lastErrorMessage;
    private double averageResponseTimeMs;

    HealthRecord(String backendId, long now) {
        this.backendId = backendId;
        this.windowStart = now;
    }

    void clear(long now) {
        consecutiveErrorCount = 0;
        successCount = 0;
        errorCount = 0;
        totalRequests = 0;
        windowStart = now;
        lastErrorAt = null;
        lastSuccessAt = null;
        lastErrorMessage = null;
        averageResponseTimeMs = 0.0;
    }

    void rollIfElapsed(long now, long windowMs) {
        if (now >= windowStart + Math.max(1L, windowMs)) {
            successCount = (int) Math.floor(successCount * DECAY);
            errorCount = (int) Math.floor(errorCount * DECAY);
            windowStart = now;
        }
    }

    void recordSuccess(long now, Long responseTimeMs) {
        totalRequests++;
        successCount++;
        consecutiveErrorCount = 0;
        lastSuccessAt = now;
        if (responseTimeMs != null && responseTimeMs >= 0) {
            averageResponseTimeMs = averageResponseTimeMs == 0.0
                ? responseTimeMs
                : averageResponseTimeMs * (1 - RESPONSE_TIME_ALPHA) + responseTimeMs * RESPONSE_TIME_ALPHA;
        }
    }

    void recordFailure(long now, String message) {
        totalRequests++;
        errorCount++;
        consecutiveErrorCount++;
        lastErrorAt = now;
        lastErrorMessage = message;
    }

    double errorRate() {
        int samples = successCount + errorCount;
        return samples == 0 ? 0.0 : (double) errorCount / samples;
    }

    HealthState evaluate(HealthProperties properties) {
        if (consecutiveErrorCount >= properties.getUnhealthyThreshold()) {
            return HealthState.UNHEALTHY;
        }
        if (consecutiveErrorCount >= properties.getDegradedThreshold()) {
            return HealthState.DEGRADED;
        }
        int samples = successCount + errorCount;
        if (samples >= properties.getMinSamples() && errorRate() > properties.getFailoverThreshold()) {
            return HealthState.DEGRADED;
        }
        return HealthState.HEALTHY;
    }

    BackendHealth snapshot(HealthProperties properties) {
        return new BackendHealth(
            backendId,
            evaluate(properties),
            consecutiveErrorCount,
            successCount,
            errorCount,
            totalRequests,
            errorRate(),
            averageResponseTimeMs,
            lastErrorAt,
            lastSuccessAt,
            lastErrorMessage
        );
    }
}
