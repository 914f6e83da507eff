package com.example.jobqueue.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with symmetric jitter.
 * <p>
 * For attempt {@code n} (starting at 1) the nominal delay is {@code base * 2^(n-1)}
 * and the actual delay is {@code max(0, d + d * jitter * u)} with {@code u} uniform
 * in (-1, 1).
 */
public class BackoffCalculator {

    private final DoubleSupplier jitterSource;

    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble(-1.0, 1.0));
    }

    /**
     * @param jitterSource supplies values in [-1, 1]
     */
    public BackoffCalculator(DoubleSupplier jitterSource) {
        this.jitterSource = jitterSource;
    }

    public Duration delayFor(RetryPolicy policy, int attempt) {
        return delayFor(policy.getBaseDelay(), policy.getJitterFactor(), attempt);
    }

    public Duration delayFor(double baseDelaySeconds, double jitterFactor, int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt starts at 1 but was " + attempt);
        }
        var nominal = baseDelaySeconds * Math.pow(2, attempt - 1);
        var actual = Math.max(0.0, nominal + nominal * jitterFactor * jitterSource.getAsDouble());
        // Truncate so the delay never exceeds the nominal bound
        return Duration.ofNanos((long) (actual * 1_000_000_000L));
    }
}
