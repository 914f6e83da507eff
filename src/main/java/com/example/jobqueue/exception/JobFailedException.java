package com.example.jobqueue.exception;

import lombok.Getter;

/**
 * Raised to a caller waiting on a job that ended FAILED or CANCELLED.
 * <p>
 * When the job ran in this JVM the original error is the cause. Otherwise only the
 * recorded type, message and stack trace are available.
 */
@Getter
public class JobFailedException extends RuntimeException {

    private final String jobId;
    private final String errorType;
    private final String errorMessage;
    private final String remoteStackTrace;

    public JobFailedException(String jobId, Throwable cause) {
        super(String.format("Job %s failed: %s: %s", jobId, cause.getClass().getName(), cause.getMessage()), cause);
        this.jobId = jobId;
        this.errorType = cause.getClass().getName();
        this.errorMessage = cause.getMessage();
        this.remoteStackTrace = null;
    }

    public JobFailedException(String jobId, String errorType, String errorMessage, String remoteStackTrace) {
        super(String.format("Job %s failed: %s: %s", jobId, errorType, errorMessage));
        this.jobId = jobId;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.remoteStackTrace = remoteStackTrace;
    }
}
