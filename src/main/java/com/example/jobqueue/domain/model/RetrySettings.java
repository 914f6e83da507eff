package com.example.jobqueue.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-job or per-schedule retry overrides. Null fields fall back to the next tier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrySettings {

    private Integer maxRetries;

    /**
     * Base delay in seconds, doubled for each further attempt
     */
    private Double retryDelay;

    private Double jitterFactor;

    /**
     * Fully qualified exception class names that are worth retrying
     */
    private List<String> retryOn;

    public RetrySettings copy() {
        return new RetrySettings(maxRetries, retryDelay, jitterFactor, retryOn == null ? null : List.copyOf(retryOn));
    }
}
