package com.osa.aggregator.backend;

import java.util.Objects;

/**
 * A configured search source. Immutable once the registry is built.
 */
public final class Backend {
    private final String id;
    private final int priority;
    private final int rateLimit;
    private final long timeoutMs;
    private final int maxRetryAttempts;
    private final boolean enabled;
    private final SearchBackend client;

    public Backend(
        String id,
        int priority,
        int rateLimit,
        long timeoutMs,
        int maxRetryAttempts,
        boolean enabled,
        SearchBackend client
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.priority = priority;
        this.rateLimit = Math.max(1, rateLimit);
        this.timeoutMs = Math.max(1L, timeoutMs);
        this.maxRetryAttempts = Math.max(0, maxRetryAttempts);
        this.enabled = enabled;
        this.client = Objects.requireNonNull(client, "client");
    }

    public String getId() {
        return id;
    }

    public int getPriority() {
        return priority;
    }

    public int getRateLimit() {
        return rateLimit;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public SearchBackend getClient() {
        return client;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Backend)) {
            return false;
        }
        return id.equals(((Backend) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Backend{" + id + ", priority=" + priority + "}";
    }
}
