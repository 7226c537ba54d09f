package com.osa.aggregator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.osa.aggregator.backend.Backend;
import com.osa.aggregator.backend.BackendErrorKind;
import com.osa.aggregator.backend.BackendException;
import com.osa.aggregator.backend.BackendRegistry;
import com.osa.aggregator.backend.ResultItem;
import com.osa.aggregator.backend.SearchOptions;
import com.osa.aggregator.balance.LoadBalancer;
import com.osa.aggregator.balance.LoadBalancerProperties;
import com.osa.aggregator.cache.ResultCacheProperties;
import com.osa.aggregator.cache.ResultCacheService;
import com.osa.aggregator.event.DispatchEventPublisher;
import com.osa.aggregator.event.DispatchEventType;
import com.osa.aggregator.execution.ConcurrencyProperties;
import com.osa.aggregator.execution.ConcurrencyQueue;
import com.osa.aggregator.execution.QueueFullException;
import com.osa.aggregator.health.BackendHealth;
import com.osa.aggregator.health.HealthMonitor;
import com.osa.aggregator.health.HealthProperties;
import com.osa.aggregator.health.HealthState;
import com.osa.aggregator.ratelimit.AdaptiveRateLimiter;
import com.osa.aggregator.ratelimit.RateLimitProperties;
import com.osa.aggregator.retry.RetryExecutor;
import com.osa.aggregator.retry.RetryPolicyFactory;
import com.osa.aggregator.retry.RetryProperties;
import com.osa.aggregator.support.FakeSearchBackend;
import com.osa.aggregator.support.RecordingEventListener;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SearchDispatcherTest {

    private final ExecutorService workers = Executors.newFixedThreadPool(4);
    private final ExecutorService callExecutor = Executors.newCachedThreadPool();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final RecordingEventListener events = new RecordingEventListener();

    private RateLimitProperties rateLimitProperties;
    private ConcurrencyProperties concurrencyProperties;
    private DispatchProperties dispatchProperties;
    private ResultCacheProperties cacheProperties;
    private LoadBalancerProperties loadBalancerProperties;

    private HealthMonitor healthMonitor;
    private AdaptiveRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        rateLimitProperties = new RateLimitProperties();
        concurrencyProperties = new ConcurrencyProperties();
        concurrencyProperties.setMaxConcurrent(4);
        dispatchProperties = new DispatchProperties();
        dispatchProperties.setRequestTimeoutMs(5000);
        dispatchProperties.setFallbackDelayMs(0);
        cacheProperties = new ResultCacheProperties();
        cacheProperties.setEnabled(false);
        loadBalancerProperties = new LoadBalancerProperties();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        callExecutor.shutdownNow();
        timer.shutdownNow();
    }

    @Test
    void timingOutBackendIsRetriedDegradedAndDoesNotBlockHealthyOne() {
        FakeSearchBackend a = FakeSearchBackend.sleeping("a", 500);
        FakeSearchBackend b = FakeSearchBackend.returning(
            "b",
            "https://b.example/1",
            "https://b.example/2",
            "https://b.example/3"
        );
        SearchDispatcher dispatcher = dispatcher(
            new Backend("a", 10, 100, 50, 2, true, a),
            new Backend("b", 5, 100, 1000, 2, true, b)
        );

        DispatchResult result = dispatcher.searchDetailed("distributed tracing", null);

        assertThat(result.getResults()).hasSize(3);
        assertThat(result.getResults()).extracting(ResultItem::getSourceBackendId).containsOnly("b");
        assertThat(result.isPartial()).isFalse();
        assertThat(a.getCalls()).isEqualTo(3);

        BackendHealth health = healthMonitor.getRecord("a").orElseThrow();
        assertThat(health.getErrorCount()).isEqualTo(3);
        assertThat(health.getState()).isEqualTo(HealthState.DEGRADED);
        assertThat(healthMonitor.getState("b")).isEqualTo(HealthState.HEALTHY);

        BackendOutcome outcomeA = outcome(result, "a");
        assertThat(outcomeA.getStatus()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcomeA.getAttempts()).isEqualTo(3);
        assertThat(outcomeA.getErrorKind()).isEqualTo("timeout");
    }

    @Test
    void terminalFailureOfOneBackendIsIsolated() {
        FakeSearchBackend a = FakeSearchBackend.failing(
            "a",
            new BackendException("a", BackendErrorKind.HTTP_ERROR, 400, "bad request", null)
        );
        dispatchProperties.setFallbackEnabled(false);
        SearchDispatcher dispatcher = dispatcher(
            new Backend("a", 10, 100, 1000, 2, true, a),
            new Backend("b", 5, 100, 1000, 2, true, FakeSearchBackend.returning("b", "https://b.example/1"))
        );

        List<ResultItem> results = dispatcher.search("query", null);

        assertThat(results).extracting(ResultItem::getUrl).containsExactly("https://b.example/1");
        assertThat(a.getCalls()).isEqualTo(1);
    }

    @Test
    void overlappingUrlsAreKeptOnceFromHigherPriorityBackend() {
        SearchDispatcher dispatcher = dispatcher(
            new Backend("high", 9, 100, 1000, 0, true, FakeSearchBackend.returning("high", "https://x.example/shared")),
            new Backend(
                "low",
                2,
                100,
                1000,
                0,
                true,
                FakeSearchBackend.returning("low", "https://x.example/shared", "https://x.example/only-low")
            )
        );

        List<ResultItem> results = dispatcher.search("shared", null);

        assertThat(results).hasSize(2);
        assertThat(results.stream().filter(item -> item.getUrl().equals("https://x.example/shared")))
            .singleElement()
            .satisfies(item -> assertThat(item.getSourceBackendId()).isEqualTo("high"));
        assertThat(results).allSatisfy(item -> assertThat(item.getAggregationMetadata().getQuery()).isEqualTo("shared"));
        assertThat(events.count(DispatchEventType.REQUEST_COMPLETED)).isEqualTo(1);
    }

    @Test
    void deadlineReturnsPartialResults() {
        FakeSearchBackend slow = FakeSearchBackend.sleeping("slow", 1500);
        SearchDispatcher dispatcher = dispatcher(
            new Backend("slow", 10, 100, 3000, 0, true, slow),
            new Backend("fast", 5, 100, 1000, 0, true, FakeSearchBackend.returning("fast", "https://fast.example/1"))
        );
        SearchOptions options = new SearchOptions();
        options.setTimeoutMs(200);

        long started = System.nanoTime();
        DispatchResult result = dispatcher.searchDetailed("slow query", options);
        long tookMs = (System.nanoTime() - started) / 1_000_000L;

        assertThat(result.isPartial()).isTrue();
        assertThat(result.getResults()).extracting(ResultItem::getSourceBackendId).containsExactly("fast");
        assertThat(outcome(result, "slow").getStatus()).isEqualTo(OutcomeStatus.TIMED_OUT);
        assertThat(tookMs).isLessThan(1200);
    }

    @Test
    void failedBackendFallsBackToHealthyUnselectedBackend() {
        FakeSearchBackend primary = FakeSearchBackend.failing(
            "primary",
            new BackendException("primary", BackendErrorKind.INVALID_RESPONSE, "garbage")
        );
        FakeSearchBackend spare = FakeSearchBackend.returning("spare", "https://spare.example/1");
        loadBalancerProperties.setMaxSources(1);
        SearchDispatcher dispatcher = dispatcher(
            new Backend("primary", 10, 100, 1000, 2, true, primary),
            new Backend("spare", 1, 100, 1000, 2, true, spare)
        );

        DispatchResult result = dispatcher.searchDetailed("fallback", null);

        assertThat(result.getResults()).extracting(ResultItem::getSourceBackendId).containsExactly("spare");
        BackendOutcome outcome = outcome(result, "primary");
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.OK);
        assertThat(outcome.getServedBy()).isEqualTo("spare");
        assertThat(spare.getCalls()).isEqualTo(1);
    }

    @Test
    void rateLimitedBackendIsSkippedWithoutBlocking() {
        rateLimitProperties.setBurstAllowance(0);
        FakeSearchBackend limited = FakeSearchBackend.returning("limited", "https://l.example/1");
        SearchDispatcher dispatcher = dispatcher(new Backend("limited", 5, 1, 1000, 0, true, limited));

        dispatcher.search("first", null);
        DispatchResult second = dispatcher.searchDetailed("second", null);

        assertThat(second.getResults()).isEmpty();
        assertThat(outcome(second, "limited").getStatus()).isEqualTo(OutcomeStatus.SKIPPED);
        assertThat(limited.getCalls()).isEqualTo(1);
        assertThat(events.count(DispatchEventType.RATE_LIMIT_EXCEEDED)).isEqualTo(1);
    }

    @Test
    void fullQueueIsReportedToCaller() {
        concurrencyProperties.setMaxConcurrent(1);
        concurrencyProperties.setMaxQueueSize(0);
        SearchDispatcher dispatcher = dispatcher(
            new Backend("a", 10, 100, 1000, 0, true, FakeSearchBackend.sleeping("a", 200)),
            new Backend("b", 5, 100, 1000, 0, true, FakeSearchBackend.returning("b", "https://b.example/1"))
        );

        assertThatThrownBy(() -> dispatcher.search("busy", null)).isInstanceOf(QueueFullException.class);
    }

    @Test
    void noHealthyBackendsIsSystemicFailure() {
        SearchDispatcher dispatcher = dispatcher(
            new Backend("a", 10, 100, 1000, 0, true, FakeSearchBackend.returning("a"))
        );
        for (int i = 0; i < 6; i++) {
            healthMonitor.recordFailure("a", new RuntimeException("down"));
        }

        assertThatThrownBy(() -> dispatcher.search("anything", null))
            .isInstanceOf(NoBackendsAvailableException.class);
    }

    @Test
    void blankQueryIsRejected() {
        SearchDispatcher dispatcher = dispatcher(
            new Backend("a", 10, 100, 1000, 0, true, FakeSearchBackend.returning("a"))
        );

        assertThatThrownBy(() -> dispatcher.search("  ", null)).isInstanceOf(InvalidSearchRequestException.class);
    }

    @Test
    void repeatedQueryIsServedFromCache() {
        cacheProperties.setEnabled(true);
        FakeSearchBackend a = FakeSearchBackend.returning("a", "https://a.example/1");
        SearchDispatcher dispatcher = dispatcher(new Backend("a", 10, 100, 1000, 0, true, a));

        dispatcher.search("Cached Query", null);
        DispatchResult second = dispatcher.searchDetailed("cached query", null);

        assertThat(second.isCached()).isTrue();
        assertThat(second.getResults()).hasSize(1);
        assertThat(second.getResults().get(0).getAggregationMetadata().getQuery()).isEqualTo("cached query");
        assertThat(second.getResults().get(0).getAggregationMetadata().getSourceBackendId()).isEqualTo("a");
        assertThat(a.getCalls()).isEqualTo(1);
    }

    @Test
    void statusReportsHealthRateLimitsAndQueue() {
        SearchDispatcher dispatcher = dispatcher(
            new Backend("a", 10, 30, 1000, 0, true, FakeSearchBackend.returning("a", "https://a.example/1")),
            new Backend("b", 5, 20, 1000, 0, false, FakeSearchBackend.returning("b"))
        );
        dispatcher.search("status", null);

        DispatcherStatus status = dispatcher.getStatus();

        assertThat(status.getTotalBackends()).isEqualTo(2);
        assertThat(status.getHealthyBackends()).isEqualTo(1);
        assertThat(status.getPerBackendHealth()).containsKeys("a", "b");
        assertThat(status.getPerBackendRateLimitRemaining()).containsEntry("a", 39).containsEntry("b", 30);
        assertThat(status.getQueueDepth()).isZero();
        assertThat(status.getStrategy()).isEqualTo("HEALTH_BASED");
    }

    private SearchDispatcher dispatcher(Backend... backends) {
        BackendRegistry registry = new BackendRegistry(List.of(backends));
        DispatchEventPublisher publisher = new DispatchEventPublisher(List.of(events));
        Clock clock = Clock.systemUTC();
        RetryExecutor retryExecutor = new RetryExecutor(callExecutor);
        RetryProperties retryProperties = new RetryProperties();
        retryProperties.setBaseDelayMs(10);
        retryProperties.setMaxDelayMs(100);
        retryProperties.setJitter(false);

        rateLimiter = new AdaptiveRateLimiter(rateLimitProperties, registry, publisher, clock);
        healthMonitor = new HealthMonitor(new HealthProperties(), registry, rateLimiter, retryExecutor, publisher, clock);
        LoadBalancer loadBalancer = new LoadBalancer(loadBalancerProperties, registry, healthMonitor, clock);
        ConcurrencyQueue queue = new ConcurrencyQueue(concurrencyProperties, workers, timer, publisher, clock);
        ResultCacheService cache = new ResultCacheService(cacheProperties, new ObjectMapper(), clock);
        return new SearchDispatcher(
            dispatchProperties,
            registry,
            healthMonitor,
            loadBalancer,
            queue,
            rateLimiter,
            retryExecutor,
            new RetryPolicyFactory(retryProperties),
            cache,
            publisher,
            clock
        );
    }

    private static BackendOutcome outcome(DispatchResult result, String backendId) {
        List<BackendOutcome> matches = new ArrayList<>();
        for (BackendOutcome outcome : result.getOutcomes()) {
            if (outcome.getBackendId().equals(backendId)) {
                matches.add(outcome);
            }
        }
        assertThat(matches).hasSize(1);
        return matches.get(0);
    }
}
