package com.osa.aggregator.health;

public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
