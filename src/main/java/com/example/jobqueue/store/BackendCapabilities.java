package com.example.jobqueue.store;

import lombok.Builder;
import lombok.Value;

/**
 * Features a job store supports. Callers check these before acting so an
 * unsupported operation fails loudly instead of quietly doing nothing.
 */
@Value
@Builder
public class BackendCapabilities {

    @Builder.Default
    boolean jobCancellation = true;

    @Builder.Default
    boolean jobDeletion = true;

    @Builder.Default
    boolean schedulePause = true;

    /**
     * Result expiry handled by the backend itself (key TTL, TTL index) rather than the purge sweep
     */
    boolean nativeResultExpiry;

    public static BackendCapabilities full() {
        return BackendCapabilities.builder().build();
    }
}
