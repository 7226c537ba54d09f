package com.osa.aggregator.execution;

import com.fasterxml.jackson.annotation.JsonProperty;

public class QueueStats {
    @JsonProperty("active")
    private final int active;

    @JsonProperty("queued")
    private final int queued;

    @JsonProperty("completed")
    private final long completed;

    @JsonProperty("failed")
    private final long failed;

    @JsonProperty("rejected")
    private final long rejected;

    @JsonProperty("timed_out")
    private final long timedOut;

    @JsonProperty("average_wait_ms")
    private final double averageWaitMs;

    public QueueStats(
        int active,
        int queued,
        long completed,
        long failed,
        long rejected,
        long timedOut,
        double averageWaitMs
    ) {
        this.active = active;
        this.queued = queued;
        this.completed = completed;
        this.failed = failed;
        this.rejected = rejected;
        this.timedOut = timedOut;
        this.averageWaitMs = averageWaitMs;
    }

    public int getActive() {
        return active;
    }

    public int getQueued() {
        return queued;
    }

    public long getCompleted() {
        return completed;
    }

    public long getFailed() {
        return failed;
    }

    public long getRejected() {
        return rejected;
    }

    public long getTimedOut() {
        return timedOut;
    }

    public double getAverageWaitMs() {
        return averageWaitMs;
    }
}
