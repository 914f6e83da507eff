package com.example.jobqueue.service.executor;

import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import lombok.Builder;
import lombok.Getter;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Result of running one job: a value, or the error that ended it.
 * <p>
 * {@link #getError()} is only present when the job ran in this JVM; jobs from child
 * processes carry the recorded type, message and stack trace instead.
 */
@Getter
@Builder
public class JobOutcome {

    private final boolean success;
    private final boolean cancelled;
    private final Object result;
    private final String errorType;
    private final String errorMessage;
    private final String errorStackTrace;
    private final Throwable error;
    private final int attempts;

    public static JobOutcome success(Object result, int attempts) {
        return JobOutcome.builder()
                .success(true)
                .result(result)
                .attempts(attempts)
                .build();
    }

    /**
     * Failure from an exception raised in this JVM
     */
    public static JobOutcome failure(Throwable error, int attempts) {
        return JobOutcome.builder()
                .success(false)
                .error(error)
                .errorType(error.getClass().getName())
                .errorMessage(error.getMessage())
                .errorStackTrace(stackTraceOf(error))
                .attempts(attempts)
                .build();
    }

    /**
     * Failure reported by a child process or recovered from the store
     */
    public static JobOutcome failure(String errorType, String errorMessage, String errorStackTrace, int attempts) {
        return JobOutcome.builder()
                .success(false)
                .errorType(errorType)
                .errorMessage(errorMessage)
                .errorStackTrace(errorStackTrace)
                .attempts(attempts)
                .build();
    }

    public static JobOutcome cancelled() {
        return JobOutcome.builder()
                .success(false)
                .cancelled(true)
                .errorType("CANCELLED")
                .errorMessage("Job was cancelled")
                .build();
    }

    /**
     * Outcome as recorded in the store for a terminal job
     */
    public static JobOutcome fromJob(Job job) {
        return switch (job.getStatus()) {
            case SUCCEEDED -> success(job.getResult(), job.getAttempts());
            case CANCELLED -> cancelled();
            default -> failure(job.getErrorType(), job.getErrorMessage(), job.getErrorStackTrace(), job.getAttempts());
        };
    }

    public JobStatus status() {
        if (success) {
            return JobStatus.SUCCEEDED;
        }
        return cancelled ? JobStatus.CANCELLED : JobStatus.FAILED;
    }

    /**
     * Full stack trace including causes, as printed by the JVM
     */
    public static String stackTraceOf(Throwable error) {
        if (error == null) {
            return null;
        }
        var writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
