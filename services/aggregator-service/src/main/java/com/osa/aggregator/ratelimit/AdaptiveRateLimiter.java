package com.osa.aggregator.ratelimit;

import com.osa.aggregator.backend.Backend;
import com.osa.aggregator.backend.BackendRegistry;
import com.osa.aggregator.event.DispatchEventPublisher;
import com.osa.aggregator.event.DispatchEventType;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-window admission control with a burst allowance and a multiplier that
 * loosens for reliable backends and tightens for flaky ones. Never blocks.
 */
@Component
public class AdaptiveRateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(AdaptiveRateLimiter.class);

    private final RateLimitProperties properties;
    private final BackendRegistry registry;
    private final DispatchEventPublisher eventPublisher;
    private final Clock clock;
    private final ConcurrentMap<String, RateLimitEntry> entries = new ConcurrentHashMap<>();

    public AdaptiveRateLimiter(
        RateLimitProperties properties,
        BackendRegistry registry,
        DispatchEventPublisher eventPublisher,
        Clock clock
    ) {
        this.properties = properties;
        this.registry = registry;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public boolean allow(String backendId) {
        Backend backend = registry.get(backendId)
            .orElseThrow(() -> new IllegalArgumentException("unknown backend: " + backendId));
        return allow(backendId, backend.getRateLimit());
    }

    public boolean allow(String key, int baseLimit) {
        long now = clock.millis();
        RateLimitEntry entry = entries.computeIfAbsent(
            key,
            k -> new RateLimitEntry(baseLimit, properties.getWindowMs(), properties.getBurstAllowance(), now)
        );
        int limit;
        int count;
        synchronized (entry) {
            entry.rollIfElapsed(now);
            entry.setBaseLimit(baseLimit);
            limit = entry.effectiveLimit(properties.isAdaptiveEnabled());
            if (entry.tryAcquire(limit, now)) {
                return true;
            }
            count = entry.getCount();
        }

        logger.warn(
            "rate_limit_exceeded key={} count={} limit={} window_ms={}",
            key,
            count,
            limit,
            properties.getWindowMs()
        );
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("count", count);
        attributes.put("limit", limit);
        attributes.put("window_ms", properties.getWindowMs());
        eventPublisher.publish(DispatchEventType.RATE_LIMIT_EXCEEDED, key, attributes);
        return false;
    }

    public void recordResult(String key, boolean success) {
        RateLimitEntry entry = entries.get(key);
        if (entry == null) {
            return;
        }
        synchronized (entry) {
            entry.rollIfElapsed(clock.millis());
            entry.record(success);
            if (properties.isAdaptiveEnabled()) {
                entry.adapt(properties.getMinSamples(), properties.getAdaptiveThreshold());
            }
        }
    }

    public int getRemaining(String key) {
        RateLimitEntry entry = entries.get(key);
        if (entry == null) {
            int baseLimit = registry.get(key).map(Backend::getRateLimit).orElse(1);
            return baseLimit + Math.max(0, properties.getBurstAllowance());
        }
        synchronized (entry) {
            int limit = entry.effectiveLimit(properties.isAdaptiveEnabled());
            if (entry.isElapsed(clock.millis())) {
                return limit + Math.max(0, properties.getBurstAllowance());
            }
            return entry.remaining(limit);
        }
    }

    public Optional<RateLimitSnapshot> snapshot(String key) {
        RateLimitEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            entry.rollIfElapsed(clock.millis());
            return Optional.of(entry.snapshot(key, entry.effectiveLimit(properties.isAdaptiveEnabled())));
        }
    }

    public double getAdaptiveMultiplier(String key) {
        return snapshot(key).map(RateLimitSnapshot::getAdaptiveMultiplier).orElse(1.0);
    }

    /**
     * Drops entries that have seen no request for two full windows.
     */
    @Scheduled(fixedDelayString = "${aggregator.rate-limit.window-ms:60000}")
    public void cleanupExpired() {
        long now = clock.millis();
        long idleMs = properties.getWindowMs() * 2;
        int removed = 0;
        for (Map.Entry<String, RateLimitEntry> item : entries.entrySet()) {
            RateLimitEntry entry = item.getValue();
            boolean idle;
            synchronized (entry) {
                idle = now - entry.getLastRequestAt() > idleMs;
            }
            if (idle && entries.remove(item.getKey(), entry)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("rate_limit_cleanup removed={}", removed);
        }
    }

    public int getTrackedKeyCount() {
        return entries.size();
    }
}
