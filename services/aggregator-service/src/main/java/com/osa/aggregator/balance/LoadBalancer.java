package com.osa.aggregator.balance;

import com.osa.aggregator.backend.Backend;
import com.osa.aggregator.backend.BackendRegistry;
import com.osa.aggregator.backend.SearchOptions;
import com.osa.aggregator.health.HealthMonitor;
import com.osa.aggregator.health.HealthState;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks which healthy backends serve a request. Ties always fall back to
 * priority descending, then id.
 */
@Component
public class LoadBalancer {
    private static final Logger logger = LoggerFactory.getLogger(LoadBalancer.class);

    private final LoadBalancerProperties properties;
    private final BackendRegistry registry;
    private final HealthMonitor healthMonitor;
    private final Clock clock;
    private final AtomicInteger roundRobinIndex = new AtomicInteger();
    private final ConcurrentMap<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> lastUsedAt = new ConcurrentHashMap<>();
    private final Random random;

    public LoadBalancer(
        LoadBalancerProperties properties,
        BackendRegistry registry,
        HealthMonitor healthMonitor,
        Clock clock
    ) {
        this.properties = properties;
        this.registry = registry;
        this.healthMonitor = healthMonitor;
        this.clock = clock;
        this.random = new Random(properties.getSeed());
    }

    public List<Backend> select(List<Backend> healthyBackends, SearchOptions options) {
        if (healthyBackends == null || healthyBackends.isEmpty()) {
            return List.of();
        }
        List<Backend> candidates = filterRequested(healthyBackends, options);
        int limit = resolveMaxSources(options);

        List<Backend> ordered = switch (properties.getStrategy()) {
            case ROUND_ROBIN -> roundRobin(candidates);
            case WEIGHTED -> weighted(candidates);
            case LEAST_CONNECTIONS -> leastConnections(candidates);
            case HEALTH_BASED -> healthBased(candidates);
        };
        List<Backend> selected = new ArrayList<>(ordered.subList(0, Math.min(limit, ordered.size())));
        long now = clock.millis();
        for (Backend backend : selected) {
            lastUsedAt.put(backend.getId(), now);
        }
        if (logger.isDebugEnabled()) {
            logger.debug(
                "backends_selected strategy={} candidates={} selected={}",
                properties.getStrategy(),
                candidates.size(),
                selected.stream().map(Backend::getId).toList()
            );
        }
        return selected;
    }

    public void acquire(String backendId) {
        inFlight.computeIfAbsent(backendId, id -> new AtomicInteger()).incrementAndGet();
    }

    public void release(String backendId) {
        AtomicInteger counter = inFlight.get(backendId);
        if (counter != null) {
            counter.updateAndGet(value -> Math.max(0, value - 1));
        }
    }

    public int getInFlight(String backendId) {
        AtomicInteger counter = inFlight.get(backendId);
        return counter == null ? 0 : counter.get();
    }

    /**
     * Highest-priority HEALTHY enabled backend other than {@code current}.
     */
    public Optional<Backend> getFallback(Backend current) {
        return getFallback(current, Set.of());
    }

    /**
     * Same as {@link #getFallback(Backend)} but also skips {@code excludedIds},
     * typically the backends already serving the request.
     */
    public Optional<Backend> getFallback(Backend current, Set<String> excludedIds) {
        String currentId = current == null ? null : current.getId();
        for (Backend backend : registry.getEnabled()) {
            if (backend.getId().equals(currentId) || excludedIds.contains(backend.getId())) {
                continue;
            }
            if (healthMonitor.getState(backend.getId()) == HealthState.HEALTHY) {
                return Optional.of(backend);
            }
        }
        return Optional.empty();
    }

    public LoadBalancerStats getStats() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Backend backend : registry.getAll()) {
            counts.put(backend.getId(), getInFlight(backend.getId()));
        }
        return new LoadBalancerStats(properties.getStrategy(), counts, new LinkedHashMap<>(lastUsedAt));
    }

    public LoadBalancingStrategy getStrategy() {
        return properties.getStrategy();
    }

    private List<Backend> filterRequested(List<Backend> healthy, SearchOptions options) {
        List<Backend> base = new ArrayList<>(healthy);
        base.sort(BackendRegistry.PRIORITY_ORDER);
        if (options == null || options.getSources() == null || options.getSources().isEmpty()) {
            return base;
        }
        Set<String> requested = new HashSet<>(options.getSources());
        List<Backend> filtered = new ArrayList<>();
        for (Backend backend : base) {
            if (requested.contains(backend.getId())) {
                filtered.add(backend);
            }
        }
        return filtered.isEmpty() ? base : filtered;
    }

    private int resolveMaxSources(SearchOptions options) {
        Integer requested = options == null ? null : options.getMaxSources();
        int limit = requested == null ? properties.getMaxSources() : requested;
        return Math.max(1, limit);
    }

    private List<Backend> roundRobin(List<Backend> candidates) {
        int size = candidates.size();
        int start = Math.floorMod(roundRobinIndex.getAndIncrement(), size);
        List<Backend> rotated = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            rotated.add(candidates.get((start + i) % size));
        }
        return rotated;
    }

    private List<Backend> weighted(List<Backend> candidates) {
        List<Backend> pool = new ArrayList<>(candidates);
        List<Backend> ordered = new ArrayList<>(pool.size());
        synchronized (random) {
            while (!pool.isEmpty()) {
                long total = 0;
                for (Backend backend : pool) {
                    total += weightOf(backend);
                }
                long pick = (long) (random.nextDouble() * total);
                int chosen = pool.size() - 1;
                for (int i = 0; i < pool.size(); i++) {
                    pick -= weightOf(pool.get(i));
                    if (pick < 0) {
                        chosen = i;
                        break;
                    }
                }
                ordered.add(pool.remove(chosen));
            }
        }
        return ordered;
    }

    private List<Backend> leastConnections(List<Backend> candidates) {
        List<Backend> ordered = new ArrayList<>(candidates);
        ordered.sort(
            Comparator.comparingInt((Backend backend) -> getInFlight(backend.getId()))
                .thenComparing(BackendRegistry.PRIORITY_ORDER)
        );
        return ordered;
    }

    private List<Backend> healthBased(List<Backend> candidates) {
        List<Backend> ordered = new ArrayList<>(candidates);
        ordered.sort(
            Comparator.comparingInt((Backend backend) -> healthMonitor.getState(backend.getId()).ordinal())
                .thenComparing(BackendRegistry.PRIORITY_ORDER)
        );
        return ordered;
    }

    private int weightOf(Backend backend) {
        return Math.max(1, backend.getPriority());
    }
}
