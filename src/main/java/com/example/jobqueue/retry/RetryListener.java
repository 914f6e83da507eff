package com.example.jobqueue.retry;

import java.time.Duration;

/**
 * Callback fired before each retry sleep.
 */
@FunctionalInterface
public interface RetryListener {

    RetryListener NONE = (attempt, delay, error) -> {
    };

    void onRetry(int attempt, Duration delay, Throwable error);
}
