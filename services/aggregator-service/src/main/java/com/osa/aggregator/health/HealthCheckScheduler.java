package com.osa.aggregator.health;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class HealthCheckScheduler {
    private final HealthMonitor healthMonitor;

    public HealthCheckScheduler(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @Scheduled(
        fixedDelayString = "${aggregator.health.check-interval-ms:30000}",
        initialDelayString = "${aggregator.health.check-interval-ms:30000}"
    )
    public void probeBackends() {
        healthMonitor.performHealthCheck();
    }
}
