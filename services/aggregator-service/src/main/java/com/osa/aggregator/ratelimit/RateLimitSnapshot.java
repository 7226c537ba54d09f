package com.osa.aggregator.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

public class RateLimitSnapshot {
    private final String key;
    private final int count;
    private final int limit;
    private final int remaining;

    @JsonProperty("burst_used")
    private final int burstUsed;

    @JsonProperty("burst_allowance")
    private final int burstAllowance;

    @JsonProperty("adaptive_multiplier")
    private final double adaptiveMultiplier;

    @JsonProperty("success_rate")
    private final double successRate;

    @JsonProperty("window_start")
    private final long windowStart;

    @JsonProperty("reset_at")
    private final long resetAt;

    public RateLimitSnapshot(
        String key,
        int count,
        int limit,
        int remaining,
        int burstUsed,
        int burstAllowance,
        double adaptiveMultiplier,
        double successRate,
        long windowStart,
        long resetAt
    ) {
        this.key = key;
        this.count = count;
        this.limit = limit;
        this.remaining = remaining;
        this.burstUsed = burstUsed;
        this.burstAllowance = burstAllowance;
        this.adaptiveMultiplier = adaptiveMultiplier;
        this.successRate = successRate;
        this.windowStart = windowStart;
        this.resetAt = resetAt;
    }

    public String getKey() {
        return key;
    }

    public int getCount() {
        return count;
    }

    public int getLimit() {
        return limit;
    }

    public int getRemaining() {
        return remaining;
    }

    public int getBurstUsed() {
        return burstUsed;
    }

    public int getBurstAllowance() {
        return burstAllowance;
    }

    public double getAdaptiveMultiplier() {
        return adaptiveMultiplier;
    }

    public double getSuccessRate() {
        return successRate;
    }

    public long getWindowStart() {
        return windowStart;
    }

    public long getResetAt() {
        return resetAt;
    }
}
