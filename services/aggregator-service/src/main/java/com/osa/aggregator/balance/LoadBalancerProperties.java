package com.osa.aggregator.balance;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aggregator.load-balancing")
public class LoadBalancerProperties {
    private LoadBalancingStrategy strategy = LoadBalancingStrategy.HEALTH_BASED;
    private int maxSources = 3;
    private long seed = 42L;

    public LoadBalancingStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(LoadBalancingStrategy strategy) {
        this.strategy = strategy;
    }

    public int getMaxSources() {
        return maxSources;
    }

    public void setMaxSources(int maxSources) {
        this.maxSources = maxSources;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }
}
