package com.osa.aggregator.retry;

import java.util.function.Predicate;

public final class RetryPolicy {
    private final String name;
    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double backoffMultiplier;
    private final boolean jitter;
    private final long timeoutMs;
    private final Predicate<RuntimeException> retryCondition;

    public RetryPolicy(
        String name,
        int maxRetries,
        long baseDelayMs,
        long maxDelayMs,
        double backoffMultiplier,
        boolean jitter,
        long timeoutMs,
        Predicate<RuntimeException> retryCondition
    ) {
        this.name = name;
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.backoffMultiplier = backoffMultiplier < 1.0 ? 1.0 : backoffMultiplier;
        this.jitter = jitter;
        this.timeoutMs = timeoutMs;
        this.retryCondition = retryCondition == null ? RetryConditions.defaultCondition() : retryCondition;
    }

    public static RetryPolicy singleAttempt(String name, long timeoutMs) {
        return new RetryPolicy(name, 0, 0L, 0L, 1.0, false, timeoutMs, RetryConditions.never());
    }

    public String getName() {
        return name;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public boolean isJitter() {
        return jitter;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public Predicate<RuntimeException> getRetryCondition() {
        return retryCondition;
    }
}
