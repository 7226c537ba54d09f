package com.osa.aggregator.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.osa.aggregator.backend.ResultItem;
import com.osa.aggregator.backend.SearchOptions;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ResultCacheService {
    private static final Logger logger = LoggerFactory.getLogger(ResultCacheService.class);

    private final ResultCacheProperties properties;
    private final ObjectMapper objectMapper;
    private final TtlCache<List<ResultItem>> cache;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResultCacheService(ResultCacheProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.cache = new TtlCache<>(properties.getMaxEntries(), clock);
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public Optional<List<ResultItem>> get(String key) {
        if (!properties.isEnabled() || key == null) {
            return Optional.empty();
        }
        Optional<List<ResultItem>> cached = cache.get(key);
        if (cached.isPresent()) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return cached;
    }

    public void put(String key, List<ResultItem> results) {
        if (!properties.isEnabled() || key == null || results == null || results.isEmpty()) {
            return;
        }
        cache.put(key, List.copyOf(results), properties.getTtlMs());
    }

    public void clear() {
        cache.invalidateAll();
    }

    /**
     * Key over the query and every option that changes which backends are
     * asked or how many results come back. Priority and timeout are excluded.
     */
    public String buildKey(String query, SearchOptions options) {
        if (query == null) {
            return null;
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("q", query.trim().toLowerCase());
        if (options != null) {
            if (options.getSources() != null && !options.getSources().isEmpty()) {
                List<String> sources = new ArrayList<>(options.getSources());
                Collections.sort(sources);
                fields.put("sources", sources);
            }
            putIfPresent(fields, "max_results", options.getMaxResults());
            putIfPresent(fields, "max_sources", options.getMaxSources());
            putIfPresent(fields, "language", options.getLanguage());
            putIfPresent(fields, "time_range", options.getTimeRange());
        }
        try {
            return properties.getKeyPrefix() + sha256Hex(objectMapper.writeValueAsString(fields));
        } catch (JsonProcessingException e) {
            logger.warn("result_cache_key_failed message={}", e.getMessage());
            return null;
        }
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("enabled", properties.isEnabled());
        stats.put("hits", hits.get());
        stats.put("misses", misses.get());
        stats.put("size", cache.size());
        return stats;
    }

    private static String sha256Hex(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(Character.forDigit((b >> 4) & 0xf, 16)).append(Character.forDigit(b & 0xf, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void putIfPresent(Map<String, Object> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
