package com.osa.aggregator.retry;

/**
 * Observes every attempt made by {@link RetryExecutor}, including the ones
 * that are retried.
 */
public interface AttemptListener {
    AttemptListener NONE = new AttemptListener() {
    };

    default void onSuccess(int attempt, long tookMs) {
    }

    default void onFailure(int attempt, RuntimeException error, long tookMs) {
    }
}
