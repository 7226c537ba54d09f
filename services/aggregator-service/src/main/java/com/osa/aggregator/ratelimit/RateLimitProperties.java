package com.osa.aggregator.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aggregator.rate-limit")
public class RateLimitProperties {
    private long windowMs = 60000;
    private int burstAllowance = 10;
    private boolean adaptiveEnabled = true;
    private double adaptiveThreshold = 0.8;
    private int minSamples = 10;

    public long getWindowMs() {
        return windowMs;
    }

    public void setWindowMs(long windowMs) {
        this.windowMs = windowMs;
    }

    public int getBurstAllowance() {
        return burstAllowance;
    }

    public void setBurstAllowance(int burstAllowance) {
        this.burstAllowance = burstAllowance;
    }

    public boolean isAdaptiveEnabled() {
        return adaptiveEnabled;
    }

    public void setAdaptiveEnabled(boolean adaptiveEnabled) {
        this.adaptiveEnabled = adaptiveEnabled;
    }

    public double getAdaptiveThreshold() {
        return adaptiveThreshold;
    }

    public void setAdaptiveThreshold(double adaptiveThreshold) {
        this.adaptiveThreshold = adaptiveThreshold;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }
}
