package com.osa.aggregator.balance;

public enum LoadBalancingStrategy {
    ROUND_ROBIN,
    WEIGHTED,
    LEAST_CONNECTIONS,
    HEALTH_BASED
}
