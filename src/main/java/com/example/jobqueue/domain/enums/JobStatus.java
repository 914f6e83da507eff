package com.example.jobqueue.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Job lifecycle states.
 * <p>
 * PENDING to RUNNING happens only through a worker lease. A job leaves RUNNING
 * for exactly one of the terminal states.
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {

    /**
     * Submitted and waiting for a worker (possibly not yet due).
     */
    PENDING("pending", "Pending"),

    /**
     * Leased by a worker slot and executing.
     */
    RUNNING("running", "Running"),

    /**
     * Finished with a result.
     */
    SUCCEEDED("succeeded", "Succeeded"),

    /**
     * Finished with an error after retries were exhausted or the error was not retryable.
     */
    FAILED("failed", "Failed"),

    /**
     * Cancelled before or while running.
     */
    CANCELLED("cancelled", "Cancelled");

    private final String code;
    private final String displayName;

    public static JobStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status code: " + code);
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean isCancellable() {
        return this == PENDING || this == RUNNING;
    }
}
