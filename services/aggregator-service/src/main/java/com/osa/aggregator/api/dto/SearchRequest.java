package com.osa.aggregator.api.dto;

import com.osa.aggregator.backend.SearchOptions;

public class SearchRequest {
    private String query;
    private SearchOptions options;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public SearchOptions getOptions() {
        return options;
    }

    public void setOptions(SearchOptions options) {
        this.options = options;
    }
}
