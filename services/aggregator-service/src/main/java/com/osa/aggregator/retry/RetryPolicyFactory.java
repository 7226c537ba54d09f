package com.osa.aggregator.retry;

import com.osa.aggregator.backend.Backend;
import org.springframework.stereotype.Component;

@Component
public class RetryPolicyFactory {
    private final RetryProperties properties;

    public RetryPolicyFactory(RetryProperties properties) {
        this.properties = properties;
    }

    public RetryPolicy policyFor(Backend backend) {
        RetryProperties.BackendPolicy override = properties.getOverrides().get(backend.getId());
        int maxRetries = backend.getMaxRetryAttempts();
        long baseDelayMs = properties.getBaseDelayMs();
        long maxDelayMs = properties.getMaxDelayMs();
        double multiplier = properties.getBackoffMultiplier();
        boolean jitter = properties.isJitter();
        if (override != null) {
            if (override.getMaxRetries() != null) {
                maxRetries = override.getMaxRetries();
            }
            if (override.getBaseDelayMs() != null) {
                baseDelayMs = override.getBaseDelayMs();
            }
            if (override.getMaxDelayMs() != null) {
                maxDelayMs = override.getMaxDelayMs();
            }
            if (override.getBackoffMultiplier() != null) {
                multiplier = override.getBackoffMultiplier();
            }
            if (override.getJitter() != null) {
                jitter = override.getJitter();
            }
        }
        return new RetryPolicy(
            backend.getId(),
            maxRetries,
            baseDelayMs,
            maxDelayMs,
            multiplier,
            jitter,
            backend.getTimeoutMs(),
            RetryConditions.defaultCondition()
        );
    }
}
