package com.osa.aggregator.execution;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * A task waiting for a free slot. Guarded by the owning queue's lock.
 */
final class QueuedRequest<T> {
    private final String id;
    private final int priority;
    private final long enqueuedAt;
    private final long timeoutMs;
    private final Supplier<T> task;
    private final CompletableFuture<T> future;
    private volatile ScheduledFuture<?> timer;

    QueuedRequest(String id, int priority, long enqueuedAt, long timeoutMs, Supplier<T> task, CompletableFuture<T> future) {
        this.id = id;
        this.priority = priority;
        this.enqueuedAt = enqueuedAt;
        this.timeoutMs = timeoutMs;
        this.task = task;
        this.future = future;
    }

    String getId() {
        return id;
    }

    int getPriority() {
        return priority;
    }

    long getEnqueuedAt() {
        return enqueuedAt;
    }

    long getTimeoutMs() {
        return timeoutMs;
    }

    Supplier<T> getTask() {
        return task;
    }

    CompletableFuture<T> getFuture() {
        return future;
    }

    void setTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
        }
    }
}
