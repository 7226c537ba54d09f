package com.osa.aggregator.balance;

import static org.assertj.core.api.Assertions.assertThat;

import com.osa.aggregator.backend.Backend;
import com.osa.aggregator.backend.BackendRegistry;
import com.osa.aggregator.backend.SearchOptions;
import com.osa.aggregator.event.DispatchEventPublisher;
import com.osa.aggregator.health.HealthMonitor;
import com.osa.aggregator.health.HealthProperties;
import com.osa.aggregator.ratelimit.AdaptiveRateLimiter;
import com.osa.aggregator.ratelimit.RateLimitProperties;
import com.osa.aggregator.retry.RetryExecutor;
import com.osa.aggregator.support.FakeSearchBackend;
import com.osa.aggregator.support.MutableClock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadBalancerTest {

    private final ExecutorService callExecutor = Executors.newCachedThreadPool();
    private final MutableClock clock = new MutableClock(0L);
    private BackendRegistry registry;
    private HealthMonitor healthMonitor;

    @BeforeEach
    void setUp() {
        registry = new BackendRegistry(
            List.of(
                backend("alpha", 10),
                backend("beta", 8),
                backend("gamma", 5),
                backend("delta", 5)
            )
        );
        DispatchEventPublisher publisher = DispatchEventPublisher.noop();
        healthMonitor = new HealthMonitor(
            new HealthProperties(),
            registry,
            new AdaptiveRateLimiter(new RateLimitProperties(), registry, publisher, clock),
            new RetryExecutor(callExecutor),
            publisher,
            clock
        );
    }

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    @Test
    void healthBasedPrefersHealthyThenPriority() {
        degrade("alpha");
        LoadBalancer balancer = balancer(LoadBalancingStrategy.HEALTH_BASED, 3);

        List<Backend> selected = balancer.select(healthMonitor.getHealthyBackends(), SearchOptions.defaults());

        assertThat(ids(selected)).containsExactly("beta", "delta", "gamma");
    }

    @Test
    void requestMaxSourcesOverridesDefault() {
        LoadBalancer balancer = balancer(LoadBalancingStrategy.HEALTH_BASED, 3);
        SearchOptions options = new SearchOptions();
        options.setMaxSources(1);

        assertThat(ids(balancer.select(registry.getEnabled(), options))).containsExactly("alpha");
    }

    @Test
    void requestedSourcesNarrowTheCandidatesWhenTheyIntersect() {
        LoadBalancer balancer = balancer(LoadBalancingStrategy.HEALTH_BASED, 3);
        SearchOptions options = new SearchOptions();
        options.setSources(List.of("gamma", "unknown"));

        assertThat(ids(balancer.select(registry.getEnabled(), options))).containsExactly("gamma");

        options.setSources(List.of("unknown"));
        assertThat(ids(balancer.select(registry.getEnabled(), options))).containsExactly("alpha", "beta", "delta");
    }

    @Test
    void roundRobinRotatesStartingBackend() {
        LoadBalancer balancer = balancer(LoadBalancingStrategy.ROUND_ROBIN, 2);

        assertThat(ids(balancer.select(registry.getEnabled(), null))).containsExactly("alpha", "beta");
        assertThat(ids(balancer.select(registry.getEnabled(), null))).containsExactly("beta", "delta");
        assertThat(ids(balancer.select(registry.getEnabled(), null))).containsExactly("delta", "gamma");
    }

    @Test
    void leastConnectionsPrefersIdleBackends() {
        LoadBalancer balancer = balancer(LoadBalancingStrategy.LEAST_CONNECTIONS, 2);
        balancer.acquire("alpha");
        balancer.acquire("beta");
        balancer.acquire("beta");

        assertThat(ids(balancer.select(registry.getEnabled(), null))).containsExactly("delta", "gamma");

        balancer.release("beta");
        balancer.release("beta");
        balancer.release("beta");
        assertThat(balancer.getInFlight("beta")).isZero();
    }

    @Test
    void weightedSelectionIsReproducibleForASeed() {
        List<List<String>> first = new ArrayList<>();
        List<List<String>> second = new ArrayList<>();
        LoadBalancer a = balancer(LoadBalancingStrategy.WEIGHTED, 4);
        LoadBalancer b = balancer(LoadBalancingStrategy.WEIGHTED, 4);
        for (int i = 0; i < 5; i++) {
            first.add(ids(a.select(registry.getEnabled(), null)));
            second.add(ids(b.select(registry.getEnabled(), null)));
        }

        assertThat(first).isEqualTo(second);
        assertThat(first.get(0)).containsExactlyInAnyOrder("alpha", "beta", "gamma", "delta");
    }

    @Test
    void fallbackIsHighestPriorityHealthyOtherBackend() {
        LoadBalancer balancer = balancer(LoadBalancingStrategy.HEALTH_BASED, 3);
        Backend alpha = registry.get("alpha").orElseThrow();

        assertThat(balancer.getFallback(alpha)).map(Backend::getId).contains("beta");

        degrade("beta");
        assertThat(balancer.getFallback(alpha)).map(Backend::getId).contains("delta");
        assertThat(balancer.getFallback(alpha, Set.of("delta", "gamma"))).isEmpty();
    }

    @Test
    void statsReportInFlightAndLastUse() {
        clock.advance(1234);
        LoadBalancer balancer = balancer(LoadBalancingStrategy.HEALTH_BASED, 1);
        balancer.select(registry.getEnabled(), null);
        balancer.acquire("alpha");

        LoadBalancerStats stats = balancer.getStats();

        assertThat(stats.getStrategy()).isEqualTo(LoadBalancingStrategy.HEALTH_BASED);
        assertThat(stats.getInFlight()).containsEntry("alpha", 1).containsEntry("beta", 0);
        assertThat(stats.getLastUsedAt()).containsOnlyKeys("alpha").containsEntry("alpha", 1234L);
    }

    private LoadBalancer balancer(LoadBalancingStrategy strategy, int maxSources) {
        LoadBalancerProperties properties = new LoadBalancerProperties();
        properties.setStrategy(strategy);
        properties.setMaxSources(maxSources);
        properties.setSeed(7L);
        return new LoadBalancer(properties, registry, healthMonitor, clock);
    }

    private void degrade(String backendId) {
        for (int i = 0; i < 3; i++) {
            healthMonitor.recordFailure(backendId, new RuntimeException("down"));
        }
    }

    private static Backend backend(String id, int priority) {
        return new Backend(id, priority, 100, 1000, 1, true, FakeSearchBackend.returning(id));
    }

    private static List<String> ids(List<Backend> backends) {
        List<String> ids = new ArrayList<>();
        for (Backend backend : backends) {
            ids.add(backend.getId());
        }
        return ids;
    }
}
