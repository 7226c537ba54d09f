package com.osa.aggregator.service;

import com.osa.aggregator.backend.AggregationMetadata;
import com.osa.aggregator.backend.Backend;
import com.osa.aggregator.backend.BackendRegistry;
import com.osa.aggregator.backend.ResultItem;
import com.osa.aggregator.backend.SearchOptions;
import com.osa.aggregator.balance.LoadBalancer;
import com.osa.aggregator.cache.ResultCacheService;
import com.osa.aggregator.event.DispatchEventPublisher;
import com.osa.aggregator.event.DispatchEventType;
import com.osa.aggregator.execution.ConcurrencyQueue;
import com.osa.aggregator.execution.QueueFullException;
import com.osa.aggregator.execution.QueueTimeoutException;
import com.osa.aggregator.health.BackendHealth;
import com.osa.aggregator.health.HealthMonitor;
import com.osa.aggregator.merge.ResultMerger;
import com.osa.aggregator.ratelimit.AdaptiveRateLimiter;
import com.osa.aggregator.retry.AttemptListener;
import com.osa.aggregator.retry.RetryExecutor;
import com.osa.aggregator.retry.RetryPolicyFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fans one query out to the selected backends and merges whatever settles
 * before the request deadline. Backend failures never escape; only
 * {@link NoBackendsAvailableException}, {@link QueueFullException} and
 * {@link InvalidSearchRequestException} do.
 */
@Service
public class SearchDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(SearchDispatcher.class);

    private final DispatchProperties properties;
    private final BackendRegistry registry;
    private final HealthMonitor healthMonitor;
    private final LoadBalancer loadBalancer;
    private final ConcurrencyQueue concurrencyQueue;
    private final AdaptiveRateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final RetryPolicyFactory retryPolicyFactory;
    private final ResultCacheService resultCache;
    private final DispatchEventPublisher eventPublisher;
    private final Clock clock;

    public SearchDispatcher(
        DispatchProperties properties,
        BackendRegistry registry,
        HealthMonitor healthMonitor,
        LoadBalancer loadBalancer,
        ConcurrencyQueue concurrencyQueue,
        AdaptiveRateLimiter rateLimiter,
        RetryExecutor retryExecutor,
        RetryPolicyFactory retryPolicyFactory,
        ResultCacheService resultCache,
        DispatchEventPublisher eventPublisher,
        Clock clock
    ) {
        this.properties = properties;
        this.registry = registry;
        this.healthMonitor = healthMonitor;
        this.loadBalancer = loadBalancer;
        this.concurrencyQueue = concurrencyQueue;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.retryPolicyFactory = retryPolicyFactory;
        this.resultCache = resultCache;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public List<ResultItem> search(String query, SearchOptions options) {
        return searchDetailed(query, options).getResults();
    }

    public DispatchResult searchDetailed(String query, SearchOptions options) {
        if (query == null || query.trim().isEmpty()) {
            throw new InvalidSearchRequestException("query is required");
        }
        String queryText = query.trim();
        SearchOptions resolved = options == null ? SearchOptions.defaults() : options;
        long started = System.nanoTime();

        String cacheKey = resultCache.isEnabled() ? resultCache.buildKey(queryText, resolved) : null;
        Optional<List<ResultItem>> cached = resultCache.get(cacheKey);
        if (cached.isPresent()) {
            logger.debug("search_cache_hit query={} results={}", queryText, cached.get().size());
            return new DispatchResult(queryText, restamp(cached.get(), queryText), List.of(), false, true, elapsedMs(started));
        }

        List<Backend> healthy = healthMonitor.getHealthyBackends();
        if (healthy.isEmpty()) {
            throw new NoBackendsAvailableException("no healthy backends available");
        }
        List<Backend> selected = loadBalancer.select(healthy, resolved);
        if (selected.isEmpty()) {
            throw new NoBackendsAvailableException("no backends selected");
        }

        long timeoutMs = resolveTimeoutMs(resolved);
        int priority = resolved.getPriority() == null ? properties.getDefaultPriority() : resolved.getPriority();
        Set<String> selectedIds = new LinkedHashSet<>();
        for (Backend backend : selected) {
            selectedIds.add(backend.getId());
        }

        Map<Backend, CompletableFuture<BackendOutcome>> futures = new LinkedHashMap<>();
        try {
            for (Backend backend : selected) {
                futures.put(
                    backend,
                    concurrencyQueue.execute(
                        () -> callBackend(backend, queryText, resolved, selectedIds, true),
                        priority,
                        timeoutMs
                    )
                );
            }
        } catch (QueueFullException e) {
            for (CompletableFuture<BackendOutcome> future : futures.values()) {
                future.cancel(false);
            }
            throw e;
        }

        long deadlineNanos = started + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        List<BackendOutcome> outcomes = new ArrayList<>(futures.size());
        boolean partial = false;
        for (Map.Entry<Backend, CompletableFuture<BackendOutcome>> entry : futures.entrySet()) {
            BackendOutcome outcome = awaitOutcome(entry.getKey(), entry.getValue(), deadlineNanos, started);
            if (outcome.getStatus() == OutcomeStatus.TIMED_OUT) {
                partial = true;
            }
            outcomes.add(outcome);
        }

        List<ResultMerger.SourceResults> sources = new ArrayList<>();
        for (BackendOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                String sourceId = outcome.getEffectiveBackendId();
                int sourcePriority = registry.get(sourceId).map(Backend::getPriority).orElse(0);
                sources.add(new ResultMerger.SourceResults(sourceId, sourcePriority, outcome.getItems()));
            }
        }
        List<ResultItem> merged = ResultMerger.merge(
            queryText,
            sources,
            Instant.now(clock).toString(),
            resolved.getMaxResults()
        );

        long tookMs = elapsedMs(started);
        logger.info(
            "search_completed query={} backends={} results={} partial={} took_ms={}",
            queryText,
            selectedIds,
            merged.size(),
            partial,
            tookMs
        );
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("query", queryText);
        attributes.put("backends", selectedIds.size());
        attributes.put("results", merged.size());
        attributes.put("partial", partial);
        attributes.put("took_ms", tookMs);
        eventPublisher.publish(DispatchEventType.REQUEST_COMPLETED, null, attributes);

        if (!partial && !merged.isEmpty()) {
            resultCache.put(cacheKey, merged);
        }
        return new DispatchResult(queryText, merged, outcomes, partial, false, tookMs);
    }

    public DispatcherStatus getStatus() {
        Map<String, BackendHealth> health = healthMonitor.getHealthMetrics();
        Map<String, Integer> remaining = new LinkedHashMap<>();
        for (Backend backend : registry.getAll()) {
            remaining.put(backend.getId(), rateLimiter.getRemaining(backend.getId()));
        }
        return new DispatcherStatus(
            registry.size(),
            healthMonitor.getHealthyBackends().size(),
            health,
            remaining,
            concurrencyQueue.getQueueDepth(),
            concurrencyQueue.getActiveCount(),
            loadBalancer.getStrategy().name(),
            concurrencyQueue.getStats(),
            loadBalancer.getStats(),
            resultCache.getStats()
        );
    }

    BackendOutcome callBackend(
        Backend backend,
        String query,
        SearchOptions options,
        Set<String> requestBackendIds,
        boolean allowFallback
    ) {
        String backendId = backend.getId();
        if (!rateLimiter.allow(backendId)) {
            return BackendOutcome.skipped(backendId, "rate_limited");
        }

        AtomicInteger attempts = new AtomicInteger();
        AttemptListener listener = new AttemptListener() {
            @Override
            public void onSuccess(int attempt, long tookMs) {
                attempts.set(attempt);
                healthMonitor.recordSuccess(backendId, tookMs);
                rateLimiter.recordResult(backendId, true);
            }

            @Override
            public void onFailure(int attempt, RuntimeException error, long tookMs) {
                attempts.set(attempt);
                healthMonitor.recordFailure(backendId, error);
                rateLimiter.recordResult(backendId, false);
            }
        };

        long started = System.nanoTime();
        BackendOutcome failure;
        loadBalancer.acquire(backendId);
        try {
            List<ResultItem> items = retryExecutor.run(
                () -> backend.getClient().search(query, options),
                retryPolicyFactory.policyFor(backend),
                listener
            );
            return BackendOutcome.ok(backendId, items, attempts.get(), elapsedMs(started));
        } catch (RuntimeException e) {
            logger.warn(
                "backend_call_failed backend={} attempts={} message={}",
                backendId,
                attempts.get(),
                e.getMessage()
            );
            failure = BackendOutcome.failed(backendId, e, attempts.get(), elapsedMs(started));
        } finally {
            loadBalancer.release(backendId);
        }

        if (!allowFallback || !properties.isFallbackEnabled()) {
            return failure;
        }
        Optional<Backend> fallback = loadBalancer.getFallback(backend, requestBackendIds);
        if (fallback.isEmpty()) {
            return failure;
        }
        if (!pause(properties.getFallbackDelayMs())) {
            return failure;
        }
        logger.warn("backend_fallback from={} to={}", backendId, fallback.get().getId());
        BackendOutcome fallbackOutcome = callBackend(fallback.get(), query, options, requestBackendIds, false);
        if (!fallbackOutcome.isSuccess()) {
            return failure;
        }
        return fallbackOutcome.servedFor(backendId, attempts.get(), elapsedMs(started));
    }

    private BackendOutcome awaitOutcome(
        Backend backend,
        CompletableFuture<BackendOutcome> future,
        long deadlineNanos,
        long startedNanos
    ) {
        long remainingNanos = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            // queued tasks leave the queue; running ones finish and are discarded
            future.cancel(false);
            logger.warn("backend_deadline_exceeded backend={}", backend.getId());
            return BackendOutcome.timedOut(backend.getId(), elapsedMs(startedNanos));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof QueueTimeoutException) {
                return BackendOutcome.timedOut(backend.getId(), elapsedMs(startedNanos));
            }
            logger.warn("backend_task_failed backend={} message={}", backend.getId(), cause == null ? null : cause.getMessage());
            return BackendOutcome.failed(backend.getId(), cause, 0, elapsedMs(startedNanos));
        } catch (CancellationException e) {
            return BackendOutcome.cancelled(backend.getId());
        } catch (InterruptedException e) {
            future.cancel(false);
            Thread.currentThread().interrupt();
            return BackendOutcome.timedOut(backend.getId(), elapsedMs(startedNanos));
        }
    }

    // cache keys ignore case, so hits carry the query as this caller typed it
    private List<ResultItem> restamp(List<ResultItem> items, String queryText) {
        List<ResultItem> stamped = new ArrayList<>(items.size());
        for (ResultItem item : items) {
            AggregationMetadata metadata = item.getAggregationMetadata();
            stamped.add(
                item.withAggregationMetadata(
                    new AggregationMetadata(
                        queryText,
                        metadata == null ? Instant.now(clock).toString() : metadata.getAggregatedAt(),
                        metadata == null ? item.getSourceBackendId() : metadata.getSourceBackendId()
                    )
                )
            );
        }
        return stamped;
    }

    private long resolveTimeoutMs(SearchOptions options) {
        Integer requested = options.getTimeoutMs();
        if (requested != null && requested > 0) {
            return requested;
        }
        return Math.max(1L, properties.getRequestTimeoutMs());
    }

    private boolean pause(long ms) {
        if (ms <= 0) {
            return true;
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
