package com.osa.aggregator.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.osa.aggregator.backend.BackendErrorKind;
import com.osa.aggregator.backend.BackendException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

    private final ExecutorService callExecutor = Executors.newCachedThreadPool();
    private final RetryExecutor executor = new RetryExecutor(callExecutor);

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    @Test
    void retriesTransientFailuresWithExponentialBackoff() {
        List<Long> startedAt = Collections.synchronizedList(new ArrayList<>());
        RecordingListener listener = new RecordingListener();
        RetryPolicy policy = new RetryPolicy("alpha", 2, 100, 10_000, 2.0, false, 1000, RetryConditions.defaultCondition());

        assertThatThrownBy(() -> executor.run(() -> {
            startedAt.add(System.nanoTime());
            throw new BackendException("alpha", BackendErrorKind.NETWORK, "connection reset");
        }, policy, listener))
            .isInstanceOf(BackendException.class)
            .hasMessage("connection reset");

        assertThat(startedAt).hasSize(3);
        assertThat(listener.failures).containsExactly(1, 2, 3);
        assertThat(TimeUnit.NANOSECONDS.toMillis(startedAt.get(1) - startedAt.get(0))).isGreaterThanOrEqualTo(100);
        assertThat(TimeUnit.NANOSECONDS.toMillis(startedAt.get(2) - startedAt.get(1))).isGreaterThanOrEqualTo(200);
    }

    @Test
    void returnsResultOnceAnAttemptSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        RecordingListener listener = new RecordingListener();
        RetryPolicy policy = new RetryPolicy("alpha", 3, 10, 100, 2.0, true, 1000, null);

        String result = executor.run(() -> {
            if (calls.incrementAndGet() < 2) {
                throw new BackendException("alpha", BackendErrorKind.HTTP_ERROR, 503, "unavailable", null);
            }
            return "ok";
        }, policy, listener);

        assertThat(result).isEqualTo("ok");
        assertThat(listener.failures).containsExactly(1);
        assertThat(listener.successes).containsExactly(2);
    }

    @Test
    void terminalErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy("alpha", 3, 10, 100, 2.0, false, 1000, RetryConditions.defaultCondition());

        assertThatThrownBy(() -> executor.run(() -> {
            calls.incrementAndGet();
            throw new BackendException("alpha", BackendErrorKind.HTTP_ERROR, 400, "bad query", null);
        }, policy, null))
            .isInstanceOf(BackendException.class);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void slowAttemptIsCancelledAndReportedAsTimeout() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy("slow", 1, 10, 10, 1.0, false, 50, RetryConditions.defaultCondition());

        long started = System.nanoTime();
        assertThatThrownBy(() -> executor.run(() -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }, policy, null))
            .isInstanceOfSatisfying(
                BackendException.class,
                e -> assertThat(e.getKind()).isEqualTo(BackendErrorKind.TIMEOUT)
            );

        assertThat(calls.get()).isEqualTo(2);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(1500);
    }

    @Test
    void interruptDuringBackoffRethrowsLastErrorAndKeepsFlag() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy("alpha", 3, 100, 100, 1.0, false, 0, RetryConditions.defaultCondition());
        BackendException failure = new BackendException("alpha", BackendErrorKind.NETWORK, "refused");

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> executor.run(() -> {
                calls.incrementAndGet();
                throw failure;
            }, policy, null)).isSameAs(failure);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }

        assertThat(calls.get()).isEqualTo(1);
    }

    private static class RecordingListener implements AttemptListener {
        private final List<Integer> successes = new ArrayList<>();
        private final List<Integer> failures = new ArrayList<>();

        @Override
        public void onSuccess(int attempt, long tookMs) {
            successes.add(attempt);
        }

        @Override
        public void onFailure(int attempt, RuntimeException error, long tookMs) {
            failures.add(attempt);
        }
    }
}
