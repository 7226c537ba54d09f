package com.osa.aggregator.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aggregator.dispatch")
public class DispatchProperties {
    private long requestTimeoutMs = 30000;
    private int defaultPriority = 5;
    private boolean fallbackEnabled = true;
    private long fallbackDelayMs = 1000;

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    public void setDefaultPriority(int defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public boolean isFallbackEnabled() {
        return fallbackEnabled;
    }

    public void setFallbackEnabled(boolean fallbackEnabled) {
        this.fallbackEnabled = fallbackEnabled;
    }

    public long getFallbackDelayMs() {
        return fallbackDelayMs;
    }

    public void setFallbackDelayMs(long fallbackDelayMs) {
        this.fallbackDelayMs = fallbackDelayMs;
    }
}
