package com.osa.aggregator.execution;

import com.osa.aggregator.event.DispatchEventPublisher;
import com.osa.aggregator.event.DispatchEventType;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Bounded-concurrency executor with a priority-ordered waiting list.
 *
 * <p>At most {@code maxConcurrent} tasks run at once. A slot is released only
 * when the task itself returns, so cancelling a running task's future does not
 * let another task start early. Lower priority values are served first; equal
 * priorities keep arrival order.
 */
@Component
public class ConcurrencyQueue {
    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyQueue.class);

    private final ConcurrencyProperties properties;
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService timerExecutor;
    private final DispatchEventPublisher eventPublisher;
    private final Clock clock;

    private final Object lock = new Object();
    private final LinkedList<QueuedRequest<?>> waiting = new LinkedList<>();
    private int activeCount;

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final AtomicLong dequeued = new AtomicLong();
    private final AtomicLong totalWaitMs = new AtomicLong();

    public ConcurrencyQueue(
        ConcurrencyProperties properties,
        @Qualifier("backendTaskExecutor") ExecutorService workerExecutor,
        @Qualifier("queueTimerExecutor") ScheduledExecutorService timerExecutor,
        DispatchEventPublisher eventPublisher,
        Clock clock
    ) {
        this.properties = properties;
        this.workerExecutor = workerExecutor;
        this.timerExecutor = timerExecutor;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public <T> CompletableFuture<T> execute(Supplier<T> task) {
        return execute(task, 0, properties.getQueueTimeoutMs());
    }

    /**
     * Starts {@code task} now if a slot is free, otherwise queues it.
     *
     * @throws QueueFullException if the waiting list is already at capacity
     */
    public <T> CompletableFuture<T> execute(Supplier<T> task, int priority, long timeoutMs) {
        CompletableFuture<T> future = new CompletableFuture<>();
        String requestId = "req-" + sequence.incrementAndGet();
        QueuedRequest<T> request;
        int depth;
        synchronized (lock) {
            if (activeCount < Math.max(1, properties.getMaxConcurrent())) {
                activeCount++;
                request = null;
                depth = 0;
            } else {
                if (waiting.size() >= properties.getMaxQueueSize()) {
                    rejected.incrementAndGet();
                    logger.warn(
                        "queue_full request_id={} queued={} max_queue_size={}",
                        requestId,
                        waiting.size(),
                        properties.getMaxQueueSize()
                    );
                    throw new QueueFullException(properties.getMaxQueueSize());
                }
                request = new QueuedRequest<>(requestId, priority, clock.millis(), timeoutMs, task, future);
                insertByPriority(request);
                depth = waiting.size();
            }
        }

        if (request == null) {
            start(requestId, task, future);
            return future;
        }

        long effectiveTimeout = timeoutMs > 0 ? timeoutMs : properties.getQueueTimeoutMs();
        if (effectiveTimeout > 0) {
            request.setTimer(timerExecutor.schedule(() -> expire(request), effectiveTimeout, TimeUnit.MILLISECONDS));
        }
        future.whenComplete((value, error) -> {
            if (future.isCancelled()) {
                removeQueued(request);
            }
        });
        logger.debug("request_queued request_id={} priority={} depth={}", requestId, priority, depth);
        eventPublisher.publish(
            DispatchEventType.REQUEST_QUEUED,
            null,
            Map.of("request_id", requestId, "priority", priority, "queue_depth", depth)
        );
        return future;
    }

    public boolean cancel(String requestId) {
        QueuedRequest<?> found = null;
        synchronized (lock) {
            Iterator<QueuedRequest<?>> it = waiting.iterator();
            while (it.hasNext()) {
                QueuedRequest<?> candidate = it.next();
                if (candidate.getId().equals(requestId)) {
                    it.remove();
                    found = candidate;
                    break;
                }
            }
        }
        if (found == null) {
            return false;
        }
        found.cancelTimer();
        found.getFuture().cancel(false);
        return true;
    }

    /**
     * Cancels every waiting request. Running tasks are not touched.
     */
    public int clearQueue() {
        List<QueuedRequest<?>> drained;
        synchronized (lock) {
            drained = new ArrayList<>(waiting);
            waiting.clear();
        }
        for (QueuedRequest<?> request : drained) {
            request.cancelTimer();
            request.getFuture().cancel(false);
        }
        if (!drained.isEmpty()) {
            logger.info("queue_cleared cancelled={}", drained.size());
        }
        return drained.size();
    }

    public int getQueueDepth() {
        synchronized (lock) {
            return waiting.size();
        }
    }

    public int getActiveCount() {
        synchronized (lock) {
            return activeCount;
        }
    }

    public QueueStats getStats() {
        int active;
        int queued;
        synchronized (lock) {
            active = activeCount;
            queued = waiting.size();
        }
        long started = dequeued.get();
        double averageWait = started == 0 ? 0.0 : (double) totalWaitMs.get() / started;
        return new QueueStats(
            active,
            queued,
            completed.get(),
            failed.get(),
            rejected.get(),
            timedOut.get(),
            averageWait
        );
    }

    private void insertByPriority(QueuedRequest<?> request) {
        int index = 0;
        for (QueuedRequest<?> existing : waiting) {
            if (existing.getPriority() > request.getPriority()) {
                break;
            }
            index++;
        }
        waiting.add(index, request);
    }

    private <T> void start(String requestId, Supplier<T> task, CompletableFuture<T> future) {
        try {
            workerExecutor.execute(() -> {
                try {
                    future.complete(task.get());
                    completed.incrementAndGet();
                } catch (RuntimeException | Error e) {
                    failed.incrementAndGet();
                    future.completeExceptionally(e);
                } finally {
                    onTaskFinished();
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("queue_worker_rejected request_id={} message={}", requestId, e.getMessage());
            failed.incrementAndGet();
            future.completeExceptionally(e);
            onTaskFinished();
        }
    }

    private void onTaskFinished() {
        QueuedRequest<?> next = null;
        synchronized (lock) {
            activeCount--;
            while (!waiting.isEmpty()) {
                QueuedRequest<?> candidate = waiting.removeFirst();
                if (!candidate.getFuture().isDone()) {
                    next = candidate;
                    activeCount++;
                    break;
                }
            }
        }
        if (next != null) {
            startQueued(next);
        }
    }

    private <T> void startQueued(QueuedRequest<T> request) {
        request.cancelTimer();
        long waitedMs = Math.max(0L, clock.millis() - request.getEnqueuedAt());
        dequeued.incrementAndGet();
        totalWaitMs.addAndGet(waitedMs);
        logger.debug("request_dequeued request_id={} waited_ms={}", request.getId(), waitedMs);
        start(request.getId(), request.getTask(), request.getFuture());
    }

    private void expire(QueuedRequest<?> request) {
        boolean removed;
        synchronized (lock) {
            removed = waiting.remove(request);
        }
        if (removed) {
            timedOut.incrementAndGet();
            logger.warn("queue_timeout request_id={} timeout_ms={}", request.getId(), request.getTimeoutMs());
            request.getFuture().completeExceptionally(new QueueTimeoutException(request.getId(), request.getTimeoutMs()));
        }
    }

    private void removeQueued(QueuedRequest<?> request) {
        boolean removed;
        synchronized (lock) {
            removed = waiting.remove(request);
        }
        if (removed) {
            request.cancelTimer();
            logger.debug("request_cancelled request_id={}", request.getId());
        }
    }
}
