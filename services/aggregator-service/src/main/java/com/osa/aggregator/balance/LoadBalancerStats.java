package com.osa.aggregator.balance;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public class LoadBalancerStats {
    @JsonProperty("strategy")
    private final LoadBalancingStrategy strategy;

    @JsonProperty("in_flight")
    private final Map<String, Integer> inFlight;

    @JsonProperty("last_used_at")
    private final Map<String, Long> lastUsedAt;

    public LoadBalancerStats(
        LoadBalancingStrategy strategy,
        Map<String, Integer> inFlight,
        Map<String, Long> lastUsedAt
    ) {
        this.strategy = strategy;
        this.inFlight = Map.copyOf(inFlight);
        this.lastUsedAt = Map.copyOf(lastUsedAt);
    }

    public LoadBalancingStrategy getStrategy() {
        return strategy;
    }

    public Map<String, Integer> getInFlight() {
        return inFlight;
    }

    public Map<String, Long> getLastUsedAt() {
        return lastUsedAt;
    }
}
