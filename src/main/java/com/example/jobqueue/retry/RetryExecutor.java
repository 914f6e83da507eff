package com.example.jobqueue.retry;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.Callable;

/**
 * Runs an operation under a {@link RetryPolicy}.
 * <p>
 * The blocking path delegates to a Resilience4j {@link Retry} whose interval function
 * and exception predicate come from the policy and the shared {@link BackoffCalculator}.
 * The reactive path builds a Reactor retry spec from the same two pieces, so thread,
 * process and fiber slots all back off identically.
 * <p>
 * Once retries are exhausted, or the error is not retryable, the last error is
 * rethrown unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class RetryExecutor {

    private final BackoffCalculator backoffCalculator;

    public <T> T execute(String name, RetryPolicy policy, Callable<T> operation) throws Exception {
        return execute(name, policy, operation, RetryListener.NONE);
    }

    public <T> T execute(String name, RetryPolicy policy, Callable<T> operation, RetryListener listener) throws Exception {
        var retry = createRetry(name, policy, listener);
        try {
            return retry.executeCheckedSupplier(operation::call);
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("Operation " + name + " raised a non-standard throwable", t);
        }
    }

    /**
     * Reactor counterpart of {@link #execute}: delays are emitted on the given scheduler
     * instead of sleeping the calling thread.
     */
    public reactor.util.retry.Retry reactiveRetry(String name, RetryPolicy policy, Scheduler scheduler, RetryListener listener) {
        return reactor.util.retry.Retry.from(signals -> signals.concatMap(signal -> {
            var attempt = (int) signal.totalRetries() + 1;
            var failure = signal.failure();

            if (!policy.isRetryable(failure)) {
                log.error("{} failed with non-retryable {} on attempt {}", name, failure.getClass().getName(), attempt);
                return Mono.error(failure);
            }
            if (!policy.canRetry(attempt)) {
                log.error("{} failed after {} attempts, giving up: {}", name, attempt, failure.getMessage());
                return Mono.error(failure);
            }

            var delay = backoffCalculator.delayFor(policy, attempt);
            log.warn("{} attempt {} failed ({}), retrying in {}ms", name, attempt, failure.getMessage(), delay.toMillis());
            listener.onRetry(attempt, delay, failure);
            return Mono.delay(delay, scheduler);
        }));
    }

    private Retry createRetry(String name, RetryPolicy policy, RetryListener listener) {
        var config = RetryConfig.custom()
                .maxAttempts(policy.getMaxRetries() + 1)
                .intervalBiFunction((attempt, outcome) -> backoffCalculator.delayFor(policy, attempt).toMillis())
                .retryOnException(policy::isRetryable)
                .build();

        var retry = Retry.of(name, config);
        retry.getEventPublisher()
                .onRetry(event -> {
                    log.warn("{} attempt {} failed ({}), retrying in {}ms", name, event.getNumberOfRetryAttempts(),
                            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "no error",
                            event.getWaitInterval().toMillis());
                    listener.onRetry(event.getNumberOfRetryAttempts(), event.getWaitInterval(), event.getLastThrowable());
                })
                .onError(event -> log.error("{} failed after {} attempts, giving up: {}", name,
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "no error"))
                .onIgnoredError(event -> log.error("{} failed with non-retryable {}", name,
                        event.getLastThrowable() != null ? event.getLastThrowable().getClass().getName() : "error"));
        return retry;
    }
}
