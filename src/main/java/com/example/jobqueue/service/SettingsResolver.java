package com.example.jobqueue.service;

import com.example.jobqueue.config.JobQueueProperties;
import com.example.jobqueue.domain.model.RetrySettings;
import com.example.jobqueue.retry.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Resolves job settings in three tiers: call arguments, then the stored
 * schedule or job template, then the configured defaults.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettingsResolver {

    private final JobQueueProperties properties;

    /**
     * Merge retry settings so every field is set
     *
     * @param call     per-call overrides, may be null
     * @param template stored template, may be null
     */
    public RetrySettings resolveRetry(RetrySettings call, RetrySettings template) {
        var defaults = properties.getRetry();
        return RetrySettings.builder()
                .maxRetries(firstNonNull(field(call, RetrySettings::getMaxRetries),
                        field(template, RetrySettings::getMaxRetries), defaults.getMaxRetries()))
                .retryDelay(firstNonNull(field(call, RetrySettings::getRetryDelay),
                        field(template, RetrySettings::getRetryDelay), defaults.getRetryDelay()))
                .jitterFactor(firstNonNull(field(call, RetrySettings::getJitterFactor),
                        field(template, RetrySettings::getJitterFactor), defaults.getJitterFactor()))
                .retryOn(firstNonNull(field(call, RetrySettings::getRetryOn),
                        field(template, RetrySettings::getRetryOn), List.of()))
                .build();
    }

    /**
     * Policy for settings already resolved by {@link #resolveRetry}
     */
    public static RetryPolicy toPolicy(RetrySettings settings) {
        if (settings == null) {
            return RetryPolicy.noRetry();
        }
        return RetryPolicy.of(
                settings.getMaxRetries() != null ? settings.getMaxRetries() : 0,
                settings.getRetryDelay() != null ? settings.getRetryDelay() : 0.0,
                settings.getJitterFactor() != null ? settings.getJitterFactor() : 0.0,
                settings.getRetryOn());
    }

    /**
     * Unknown queues fall back to the default queue with a warning
     */
    public String resolveQueue(String call, String template) {
        var requested = firstNonNull(call, template, null);
        if (requested == null) {
            return properties.getDefaultQueue();
        }
        if (!properties.getQueues().contains(requested)) {
            log.warn("Queue '{}' not found, using '{}'", requested, properties.getDefaultQueue());
            return properties.getDefaultQueue();
        }
        return requested;
    }

    public Duration resolveResultTtl(Duration call, Duration template) {
        return firstNonNull(call, template, null);
    }

    @SafeVarargs
    static <T> T firstNonNull(T... values) {
        for (var value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static <T> T field(RetrySettings settings, Function<RetrySettings, T> getter) {
        return settings == null ? null : getter.apply(settings);
    }
}
