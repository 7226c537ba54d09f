package com.osa.aggregator.cache;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded in-process cache with per-entry expiry. Evicts in insertion order
 * once {@code maxEntries} is exceeded; a re-put key moves to the back.
 */
public class TtlCache<V> {
    private final LinkedHashMap<String, Timed<V>> entries = new LinkedHashMap<>();
    private final int maxEntries;
    private final Clock clock;

    public TtlCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        synchronized (entries) {
            Timed<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (clock.millis() > entry.expiresAt) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.value);
        }
    }

    public void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        long expiresAt = clock.millis() + ttlMs;
        synchronized (entries) {
            entries.remove(key);
            entries.put(key, new Timed<>(value, expiresAt));
            Iterator<Map.Entry<String, Timed<V>>> oldest = entries.entrySet().iterator();
            while (entries.size() > maxEntries && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
        }
    }

    public void invalidateAll() {
        synchronized (entries) {
            entries.clear();
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private static final class Timed<V> {
        private final V value;
        private final long expiresAt;

        private Timed(V value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
