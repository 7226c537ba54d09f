package com.osa.aggregator.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.osa.aggregator.backend.ResultItem;
import com.osa.aggregator.backend.SearchOptions;
import com.osa.aggregator.support.MutableClock;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResultCacheServiceTest {

    private final MutableClock clock = new MutableClock(0L);

    @Test
    void keyIgnoresCaseWhitespaceAndSourceOrder() {
        ResultCacheService cache = cache(true, 1000, 10);
        SearchOptions first = new SearchOptions();
        first.setSources(List.of("b", "a"));
        first.setPriority(1);
        SearchOptions second = new SearchOptions();
        second.setSources(List.of("a", "b"));
        second.setPriority(9);

        assertThat(cache.buildKey("  Rust Async ", first)).isEqualTo(cache.buildKey("rust async", second));
        assertThat(cache.buildKey("rust async", first)).startsWith("results:");

        second.setMaxResults(5);
        assertThat(cache.buildKey("rust async", first)).isNotEqualTo(cache.buildKey("rust async", second));
    }

    @Test
    void entriesExpireAfterTtl() {
        ResultCacheService cache = cache(true, 1000, 10);
        String key = cache.buildKey("q", null);
        cache.put(key, List.of(new ResultItem("https://x.example", "x", "a", 1.0)));

        assertThat(cache.get(key)).hasValueSatisfying(items -> assertThat(items).hasSize(1));

        clock.advance(1001);
        assertThat(cache.get(key)).isEmpty();
        assertThat(cache.getStats()).containsEntry("hits", 1L).containsEntry("misses", 1L);
    }

    @Test
    void emptyResultsAndDisabledCacheAreNotStored() {
        ResultCacheService enabled = cache(true, 1000, 10);
        String key = enabled.buildKey("q", null);
        enabled.put(key, List.of());
        assertThat(enabled.get(key)).isEmpty();

        ResultCacheService disabled = cache(false, 1000, 10);
        disabled.put(key, List.of(new ResultItem("https://x.example", "x", "a", 1.0)));
        assertThat(disabled.get(key)).isEmpty();
    }

    @Test
    void oldestEntryIsEvictedBeyondMaxEntries() {
        ResultCacheService cache = cache(true, 10_000, 2);
        List<ResultItem> items = List.of(new ResultItem("https://x.example", "x", "a", 1.0));
        cache.put("k1", items);
        cache.put("k2", items);
        cache.put("k3", items);

        assertThat(cache.get("k1")).isEmpty();
        assertThat(cache.get("k3")).isPresent();
        assertThat(cache.getStats()).containsEntry("size", 2);
    }

    private ResultCacheService cache(boolean enabled, long ttlMs, int maxEntries) {
        ResultCacheProperties properties = new ResultCacheProperties();
        properties.setEnabled(enabled);
        properties.setTtlMs(ttlMs);
        properties.setMaxEntries(maxEntries);
        return new ResultCacheService(properties, new ObjectMapper(), clock);
    }
}
