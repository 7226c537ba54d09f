package com.osa.aggregator.retry;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aggregator.retry")
public class RetryProperties {
    private long baseDelayMs = 1000;
    private long maxDelayMs = 30000;
    private double backoffMultiplier = 2.0;
    private boolean jitter = true;
    private Map<String, BackendPolicy> overrides = new LinkedHashMap<>();

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public boolean isJitter() {
        return jitter;
    }

    public void setJitter(boolean jitter) {
        this.jitter = jitter;
    }

    public Map<String, BackendPolicy> getOverrides() {
        return overrides;
    }

    public void setOverrides(Map<String, BackendPolicy> overrides) {
        this.overrides = overrides;
    }

    /**
     * Per-backend policy values; unset fields fall back to the defaults above.
     */
    public static class BackendPolicy {
        private Integer maxRetries;
        private Long baseDelayMs;
        private Long maxDelayMs;
        private Double backoffMultiplier;
        private Boolean jitter;

        public Integer getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(Long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public Long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(Long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public Double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(Double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Boolean getJitter() {
            return jitter;
        }

        public void setJitter(Boolean jitter) {
            this.jitter = jitter;
        }
    }
}
