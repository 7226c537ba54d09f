package com.osa.aggregator.health;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aggregator.health")
public class HealthProperties {
    private long checkIntervalMs = 30000;
    private int degradedThreshold = 3;
    private int unhealthyThreshold = 6;
    private double failoverThreshold = 0.5;
    private int minSamples = 5;
    private long evaluationWindowMs = 60000;
    private boolean probeEnabled = true;

    public long getCheckIntervalMs() {
        return checkIntervalMs;
    }

    public void setCheckIntervalMs(long checkIntervalMs) {
        this.checkIntervalMs = checkIntervalMs;
    }

    public int getDegradedThreshold() {
        return degradedThreshold;
    }

    public void setDegradedThreshold(int degradedThreshold) {
        this.degradedThreshold = degradedThreshold;
    }

    public int getUnhealthyThreshold() {
        return unhealthyThreshold;
    }

    public void setUnhealthyThreshold(int unhealthyThreshold) {
        this.unhealthyThreshold = unhealthyThreshold;
    }

    public double getFailoverThreshold() {
        return failoverThreshold;
    }

    public void setFailoverThreshold(double failoverThreshold) {
        this.failoverThreshold = failoverThreshold;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public long getEvaluationWindowMs() {
        return evaluationWindowMs;
    }

    public void setEvaluationWindowMs(long evaluationWindowMs) {
        this.evaluationWindowMs = evaluationWindowMs;
    }

    public boolean isProbeEnabled() {
        return probeEnabled;
    }

    public void setProbeEnabled(boolean probeEnabled) {
        this.probeEnabled = probeEnabled;
    }
}
