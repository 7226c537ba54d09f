package com.osa.aggregator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.osa.aggregator.balance.LoadBalancerStats;
import com.osa.aggregator.execution.QueueStats;
import com.osa.aggregator.health.BackendHealth;
import java.util.Map;

public class DispatcherStatus {
    @JsonProperty("total_backends")
    private final int totalBackends;

    @JsonProperty("healthy_backends")
    private final int healthyBackends;

    @JsonProperty("health")
    private final Map<String, BackendHealth> perBackendHealth;

    @JsonProperty("rate_limit_remaining")
    private final Map<String, Integer> perBackendRateLimitRemaining;

    @JsonProperty("queue_depth")
    private final int queueDepth;

    @JsonProperty("active_count")
    private final int activeCount;

    @JsonProperty("strategy")
    private final String strategy;

    @JsonProperty("queue")
    private final QueueStats queueStats;

    @JsonProperty("load_balancer")
    private final LoadBalancerStats loadBalancerStats;

    @JsonProperty("cache")
    private final Map<String, Object> cacheStats;

    public DispatcherStatus(
        int totalBackends,
        int healthyBackends,
        Map<String, BackendHealth> perBackendHealth,
        Map<String, Integer> perBackendRateLimitRemaining,
        int queueDepth,
        int activeCount,
        String strategy,
        QueueStats queueStats,
        LoadBalancerStats loadBalancerStats,
        Map<String, Object> cacheStats
    ) {
        this.totalBackends = totalBackends;
        this.healthyBackends = healthyBackends;
        this.perBackendHealth = perBackendHealth;
        this.perBackendRateLimitRemaining = perBackendRateLimitRemaining;
        this.queueDepth = queueDepth;
        this.activeCount = activeCount;
        this.strategy = strategy;
        this.queueStats = queueStats;
        this.loadBalancerStats = loadBalancerStats;
        this.cacheStats = cacheStats;
    }

    public int getTotalBackends() {
        return totalBackends;
    }

    public int getHealthyBackends() {
        return healthyBackends;
    }

    public Map<String, BackendHealth> getPerBackendHealth() {
        return perBackendHealth;
    }

    public Map<String, Integer> getPerBackendRateLimitRemaining() {
        return perBackendRateLimitRemaining;
    }

    public int getQueueDepth() {
        return queueDepth;
    }

    public int getActiveCount() {
        return activeCount;
    }

    public String getStrategy() {
        return strategy;
    }

    public QueueStats getQueueStats() {
        return queueStats;
    }

    public LoadBalancerStats getLoadBalancerStats() {
        return loadBalancerStats;
    }

    public Map<String, Object> getCacheStats() {
        return cacheStats;
    }
}
