package com.osa.aggregator.ratelimit;

/**
 * Per-key window state. Every access goes through the owning limiter while
 * holding this entry's monitor.
 */
class RateLimitEntry {
    static final double MIN_MULTIPLIER = 0.5;
    static final double MAX_MULTIPLIER = 2.0;
    private static final double DECAY = 0.8;

    private final long windowMs;
    private final int burstAllowance;
    private int baseLimit;
    private long windowStart;
    private long lastRequestAt;
    private int count;
    private int burstUsed;
    private int successCount;
    private int failureCount;
    private double adaptiveMultiplier = 1.0;

    RateLimitEntry(int baseLimit, long windowMs, int burstAllowance, long now) {
        this.baseLimit = baseLimit;
        this.windowMs = Math.max(1L, windowMs);
        this.burstAllowance = Math.max(0, burstAllowance);
        this.windowStart = now;
        this.lastRequestAt = now;
    }

    void rollIfElapsed(long now) {
        if (now >= windowStart + windowMs) {
            count = 0;
            burstUsed = 0;
            windowStart = now;
            successCount = (int) Math.floor(successCount * DECAY);
            failureCount = (int) Math.floor(failureCount * DECAY);
        }
    }

    boolean isElapsed(long now) {
        return now >= windowStart + windowMs;
    }

    void setBaseLimit(int baseLimit) {
        this.baseLimit = baseLimit;
    }

    int effectiveLimit(boolean adaptive) {
        if (!adaptive) {
            return Math.max(1, baseLimit);
        }
        return Math.max(1, (int) Math.floor(baseLimit * adaptiveMultiplier));
    }

    boolean tryAcquire(int limit, long now) {
        if (count < limit) {
            count++;
            lastRequestAt = now;
            return true;
        }
        if (burstUsed < burstAllowance) {
            burstUsed++;
            count++;
            lastRequestAt = now;
            return true;
        }
        return false;
    }

    void record(boolean success) {
        if (success) {
            successCount++;
        } else {
            failureCount++;
        }
    }

    void adapt(int minSamples, double threshold) {
        int samples = successCount + failureCount;
        if (samples < minSamples) {
            return;
        }
        double successRate = (double) successCount / samples;
        if (successRate >= threshold) {
            adaptiveMultiplier = Math.min(MAX_MULTIPLIER, adaptiveMultiplier * 1.1);
        } else {
            adaptiveMultiplier = Math.max(MIN_MULTIPLIER, adaptiveMultiplier * 0.9);
        }
    }

    int remaining(int limit) {
        return Math.max(0, limit - count) + Math.max(0, burstAllowance - burstUsed);
    }

    RateLimitSnapshot snapshot(String key, int limit) {
        int samples = successCount + failureCount;
        double successRate = samples == 0 ? 1.0 : (double) successCount / samples;
        return new RateLimitSnapshot(
            key,
            count,
            limit,
            remaining(limit),
            burstUsed,
            burstAllowance,
            adaptiveMultiplier,
            successRate,
            windowStart,
            windowStart + windowMs
        );
    }

    long getLastRequestAt() {
        return lastRequestAt;
    }

    int getCount() {
        return count;
    }
}
