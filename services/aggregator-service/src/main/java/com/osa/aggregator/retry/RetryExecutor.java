package com.osa.aggregator.retry;

import com.osa.aggregator.backend.BackendErrorKind;
import com.osa.aggregator.backend.BackendException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs one backend call with a hard per-attempt deadline and exponential
 * backoff. Retries of the same call are strictly sequential on the calling
 * thread.
 */
@Component
public class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final ExecutorService attemptExecutor;

    public RetryExecutor(@Qualifier("backendCallExecutor") ExecutorService attemptExecutor) {
        this.attemptExecutor = attemptExecutor;
    }

    public <T> T run(Supplier<T> operation, RetryPolicy policy, AttemptListener listener) {
        AttemptListener attemptListener = listener == null ? AttemptListener.NONE : listener;
        long delayMs = Math.min(policy.getBaseDelayMs(), policy.getMaxDelayMs());
        int attempt = 0;
        while (true) {
            long started = System.nanoTime();
            try {
                T result = attemptOnce(operation, policy);
                attemptListener.onSuccess(attempt + 1, elapsedMs(started));
                if (attempt > 0) {
                    logger.info("retry_succeeded target={} attempts={}", policy.getName(), attempt + 1);
                }
                return result;
            } catch (RuntimeException e) {
                attemptListener.onFailure(attempt + 1, e, elapsedMs(started));
                if (attempt >= policy.getMaxRetries()) {
                    logger.warn(
                        "retry_exhausted target={} attempts={} message={}",
                        policy.getName(),
                        attempt + 1,
                        e.getMessage()
                    );
                    throw e;
                }
                if (!policy.getRetryCondition().test(e)) {
                    logger.warn(
                        "retry_aborted target={} attempt={} reason=non_retryable message={}",
                        policy.getName(),
                        attempt + 1,
                        e.getMessage()
                    );
                    throw e;
                }

                long sleepMs = policy.isJitter() ? jitter(delayMs, policy.getMaxDelayMs()) : delayMs;
                logger.warn(
                    "retry_scheduled target={} attempt={} delay_ms={} message={}",
                    policy.getName(),
                    attempt + 1,
                    sleepMs,
                    e.getMessage()
                );
                if (!sleep(sleepMs)) {
                    throw e;
                }
                delayMs = Math.min((long) (delayMs * policy.getBackoffMultiplier()), policy.getMaxDelayMs());
                attempt++;
            }
        }
    }

    private <T> T attemptOnce(Supplier<T> operation, RetryPolicy policy) {
        if (policy.getTimeoutMs() <= 0) {
            return operation.get();
        }
        CompletableFuture<T> future = CompletableFuture.supplyAsync(operation, attemptExecutor);
        try {
            return future.get(policy.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw BackendException.timeout(policy.getName(), policy.getTimeoutMs());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new BackendException(
                policy.getName(),
                BackendErrorKind.INVALID_RESPONSE,
                null,
                cause == null ? e.getMessage() : cause.getMessage(),
                cause
            );
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendException(policy.getName(), BackendErrorKind.TIMEOUT, null, "interrupted", e);
        }
    }

    private long jitter(long delayMs, long maxDelayMs) {
        double factor = 0.5 + ThreadLocalRandom.current().nextDouble();
        return Math.min((long) (delayMs * factor), maxDelayMs);
    }

    private boolean sleep(long ms) {
        if (ms <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
