package com.osa.aggregator.merge;

import com.osa.aggregator.backend.AggregationMetadata;
import com.osa.aggregator.backend.ResultItem;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-backend result lists into one list. The first item seen for a URL
 * wins, so sources must be passed in the order that should win collisions.
 */
public final class ResultMerger {
    private ResultMerger() {
    }

    public static List<ResultItem> merge(String query, List<SourceResults> sources, String aggregatedAt, Integer maxResults) {
        List<SourceResults> ordered = new ArrayList<>(sources == null ? List.of() : sources);
        // stable: equal priorities keep selection order
        ordered.sort(Comparator.comparingInt(SourceResults::getPriority).reversed());

        Map<String, Ranked> byUrl = new LinkedHashMap<>();
        for (SourceResults source : ordered) {
            for (ResultItem item : source.getItems()) {
                if (item == null || item.getUrl() == null || item.getUrl().isBlank()) {
                    continue;
                }
                String key = item.getUrl();
                if (byUrl.containsKey(key)) {
                    continue;
                }
                AggregationMetadata metadata = new AggregationMetadata(query, aggregatedAt, source.getBackendId());
                byUrl.put(key, new Ranked(item.withAggregationMetadata(metadata), source.getPriority()));
            }
        }

        List<Ranked> ranked = new ArrayList<>(byUrl.values());
        ranked.sort(
            Comparator.comparingDouble((Ranked r) -> r.item.getRelevanceScore()).reversed()
                .thenComparing(Comparator.comparingInt((Ranked r) -> r.priority).reversed())
        );

        int limit = maxResults == null || maxResults <= 0 ? ranked.size() : Math.min(maxResults, ranked.size());
        List<ResultItem> merged = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            merged.add(ranked.get(i).item);
        }
        return merged;
    }

    private static final class Ranked {
        private final ResultItem item;
        private final int priority;

        private Ranked(ResultItem item, int priority) {
            this.item = item;
            this.priority = priority;
        }
    }

    public static final class SourceResults {
        private final String backendId;
        private final int priority;
        private final List<ResultItem> items;

        public SourceResults(String backendId, int priority, List<ResultItem> items) {
            this.backendId = backendId;
            this.priority = priority;
            this.items = items == null ? List.of() : items;
        }

        public String getBackendId() {
            return backendId;
        }

        public int getPriority() {
            return priority;
        }

        public List<ResultItem> getItems() {
            return items;
        }
    }
}
