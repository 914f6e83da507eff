package com.example.jobqueue.retry;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.util.ClassUtils;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Retry budget, backoff base and the set of exception types worth retrying.
 */
@Getter
@ToString
public class RetryPolicy {

    private static final Set<Class<? extends Throwable>> DEFAULT_RETRYABLE = Set.of(Exception.class);

    private final int maxRetries;

    /**
     * Seconds before the first retry
     */
    private final double baseDelay;

    private final double jitterFactor;

    private final Set<Class<? extends Throwable>> retryOn;

    @Builder
    public RetryPolicy(int maxRetries, double baseDelay, double jitterFactor, Set<Class<? extends Throwable>> retryOn) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 but was " + maxRetries);
        }
        if (baseDelay < 0) {
            throw new IllegalArgumentException("baseDelay must be >= 0 but was " + baseDelay);
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1] but was " + jitterFactor);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.jitterFactor = jitterFactor;
        this.retryOn = retryOn == null || retryOn.isEmpty() ? DEFAULT_RETRYABLE : Set.copyOf(retryOn);
    }

    public static RetryPolicy noRetry() {
        return RetryPolicy.builder().build();
    }

    /**
     * Build a policy from stored settings where the retryable types are class names.
     *
     * @throws IllegalArgumentException if a name is not a Throwable class on the classpath
     */
    public static RetryPolicy of(int maxRetries, double baseDelay, double jitterFactor, List<String> retryOn) {
        Set<Class<? extends Throwable>> types = retryOn == null ? Set.of() : retryOn.stream()
                .map(RetryPolicy::resolveThrowable)
                .collect(Collectors.toSet());
        return new RetryPolicy(maxRetries, baseDelay, jitterFactor, types);
    }

    public boolean isRetryable(Throwable error) {
        return error != null && retryOn.stream().anyMatch(type -> type.isInstance(error));
    }

    public boolean canRetry(int attempt) {
        return attempt <= maxRetries;
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Throwable> resolveThrowable(String className) {
        try {
            var type = ClassUtils.forName(className, RetryPolicy.class.getClassLoader());
            if (!Throwable.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(className + " is not an exception type");
            }
            return (Class<? extends Throwable>) type;
        } catch (ClassNotFoundException | LinkageError e) {
            throw new IllegalArgumentException("Unknown retryable exception type: " + className, e);
        }
    }
}
