package com.osa.aggregator.health;

import com.osa.aggregator.backend.Backend;
import com.osa.aggregator.backend.BackendRegistry;
import com.osa.aggregator.event.DispatchEventPublisher;
import com.osa.aggregator.event.DispatchEventType;
import com.osa.aggregator.ratelimit.AdaptiveRateLimiter;
import com.osa.aggregator.retry.RetryExecutor;
import com.osa.aggregator.retry.RetryPolicy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies every backend as HEALTHY, DEGRADED or UNHEALTHY from rolling
 * success and error counters. Only classifies; never throws to callers.
 */
@Component
public class HealthMonitor {
    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    private final HealthProperties properties;
    private final BackendRegistry registry;
    private final AdaptiveRateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final DispatchEventPublisher eventPublisher;
    private final Clock clock;
    // fixed at construction; each record is mutated only under its own monitor
    private final Map<String, HealthRecord> records;

    public HealthMonitor(
        HealthProperties properties,
        BackendRegistry registry,
        AdaptiveRateLimiter rateLimiter,
        RetryExecutor retryExecutor,
        DispatchEventPublisher eventPublisher,
        Clock clock
    ) {
        this.properties = properties;
        this.registry = registry;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        long now = clock.millis();
        Map<String, HealthRecord> initial = new LinkedHashMap<>();
        for (Backend backend : registry.getAll()) {
            initial.put(backend.getId(), new HealthRecord(backend.getId(), now));
        }
        this.records = Collections.unmodifiableMap(initial);
    }

    public void recordSuccess(String backendId, Long responseTimeMs) {
        HealthRecord record = records.get(backendId);
        if (record == null) {
            logger.debug("health_record_unknown backend={}", backendId);
            return;
        }
        HealthState before;
        HealthState after;
        synchronized (record) {
            long now = clock.millis();
            record.rollIfElapsed(now, properties.getEvaluationWindowMs());
            before = record.evaluate(properties);
            record.recordSuccess(now, responseTimeMs);
            after = record.evaluate(properties);
        }
        onTransition(backendId, before, after, null);
    }

    public void recordFailure(String backendId, Throwable error) {
        HealthRecord record = records.get(backendId);
        if (record == null) {
            logger.debug("health_record_unknown backend={}", backendId);
            return;
        }
        String message = error == null ? null : error.getMessage();
        HealthState before;
        HealthState after;
        int consecutive;
        synchronized (record) {
            long now = clock.millis();
            record.rollIfElapsed(now, properties.getEvaluationWindowMs());
            before = record.evaluate(properties);
            record.recordFailure(now, message);
            after = record.evaluate(properties);
            consecutive = record.snapshot(properties).getConsecutiveErrorCount();
        }
        logger.debug("backend_error backend={} consecutive={} message={}", backendId, consecutive, message);
        onTransition(backendId, before, after, message);
    }

    public HealthState getState(String backendId) {
        HealthRecord record = records.get(backendId);
        if (record == null) {
            return HealthState.UNHEALTHY;
        }
        synchronized (record) {
            record.rollIfElapsed(clock.millis(), properties.getEvaluationWindowMs());
            return record.evaluate(properties);
        }
    }

    public Optional<BackendHealth> getRecord(String backendId) {
        HealthRecord record = records.get(backendId);
        if (record == null) {
            return Optional.empty();
        }
        synchronized (record) {
            record.rollIfElapsed(clock.millis(), properties.getEvaluationWindowMs());
            return Optional.of(record.snapshot(properties));
        }
    }

    public Map<String, BackendHealth> getHealthMetrics() {
        Map<String, BackendHealth> metrics = new LinkedHashMap<>();
        for (String backendId : records.keySet()) {
            getRecord(backendId).ifPresent(health -> metrics.put(backendId, health));
        }
        return metrics;
    }

    /**
     * Enabled backends that are not UNHEALTHY, in registry order.
     */
    public List<Backend> getHealthyBackends() {
        List<Backend> healthy = new ArrayList<>();
        for (Backend backend : registry.getEnabled()) {
            if (getState(backend.getId()) != HealthState.UNHEALTHY) {
                healthy.add(backend);
            }
        }
        return healthy;
    }

    public void reset(String backendId) {
        HealthRecord record = records.get(backendId);
        if (record == null) {
            return;
        }
        HealthState before;
        synchronized (record) {
            before = record.evaluate(properties);
            record.clear(clock.millis());
        }
        logger.info("health_reset backend={}", backendId);
        onTransition(backendId, before, HealthState.HEALTHY, null);
    }

    /**
     * Probes every enabled backend that is not HEALTHY, so a backend that went
     * idle while failing can recover without live traffic.
     */
    public void performHealthCheck() {
        if (!properties.isProbeEnabled()) {
            return;
        }
        for (Backend backend : registry.getEnabled()) {
            if (getState(backend.getId()) == HealthState.HEALTHY) {
                continue;
            }
            if (!rateLimiter.allow(backend.getId())) {
                logger.debug("health_probe_skipped backend={} reason=rate_limited", backend.getId());
                continue;
            }
            long started = System.nanoTime();
            try {
                retryExecutor.run(
                    () -> backend.getClient().probe(),
                    RetryPolicy.singleAttempt(backend.getId(), backend.getTimeoutMs()),
                    null
                );
                long tookMs = (System.nanoTime() - started) / 1_000_000L;
                rateLimiter.recordResult(backend.getId(), true);
                recordSuccess(backend.getId(), tookMs);
                logger.info("health_probe_ok backend={} took_ms={}", backend.getId(), tookMs);
            } catch (RuntimeException e) {
                rateLimiter.recordResult(backend.getId(), false);
                recordFailure(backend.getId(), e);
                logger.warn("health_probe_failed backend={} message={}", backend.getId(), e.getMessage());
            }
        }
    }

    private void onTransition(String backendId, HealthState before, HealthState after, String message) {
        if (before == after) {
            return;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("from", before.name());
        attributes.put("to", after.name());
        if (message != null) {
            attributes.put("message", message);
        }
        if (after == HealthState.HEALTHY) {
            eventPublisher.publish(DispatchEventType.BACKEND_RECOVERED, backendId, attributes);
        } else if (after.ordinal() > before.ordinal()) {
            eventPublisher.publish(DispatchEventType.BACKEND_FAILED, backendId, attributes);
        } else {
            logger.info("backend_health_improved backend={} from={} to={}", backendId, before, after);
        }
    }
}
