package com.osa.aggregator.execution;

public class QueueFullException extends RuntimeException {
    private final int maxQueueSize;

    public QueueFullException(int maxQueueSize) {
        super("request queue is full (max " + maxQueueSize + ")");
        this.maxQueueSize = maxQueueSize;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }
}
