package com.osa.aggregator.service;

import com.osa.aggregator.backend.ResultItem;
import java.util.List;

public class DispatchResult {
    private final String query;
    private final List<ResultItem> results;
    private final List<BackendOutcome> outcomes;
    private final boolean partial;
    private final boolean cached;
    private final long tookMs;

    public DispatchResult(
        String query,
        List<ResultItem> results,
        List<BackendOutcome> outcomes,
        boolean partial,
        boolean cached,
        long tookMs
    ) {
        this.query = query;
        this.results = results == null ? List.of() : List.copyOf(results);
        this.outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        this.partial = partial;
        this.cached = cached;
        this.tookMs = tookMs;
    }

    public String getQuery() {
        return query;
    }

    public List<ResultItem> getResults() {
        return results;
    }

    public List<BackendOutcome> getOutcomes() {
        return outcomes;
    }

    public boolean isPartial() {
        return partial;
    }

    public boolean isCached() {
        return cached;
    }

    public long getTookMs() {
        return tookMs;
    }
}
