package com.osa.aggregator.backend;

import java.util.List;

/**
 * Capability implemented by every per-source client. Implementations return
 * normalized hits or throw {@link BackendException}; they must not retry or
 * rate limit on their own.
 */
public interface SearchBackend {
    String id();

    List<ResultItem> search(String query, SearchOptions options);

    default List<ResultItem> probe() {
        SearchOptions options = new SearchOptions();
        options.setMaxResults(1);
        return search("health check", options);
    }
}
