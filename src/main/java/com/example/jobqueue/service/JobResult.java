package com.example.jobqueue.service;

import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.service.executor.JobOutcome;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Answer to a result query. Distinguishes "not finished yet" from a finished
 * job whose result is null.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobResult {

    /**
     * No such job, or it vanished while waiting
     */
    private static final JobResult NOT_READY = new JobResult(false, null, null, null, null);

    private final boolean ready;
    private final JobStatus status;
    private final Object value;
    private final String errorType;
    private final String errorMessage;

    public static JobResult notReady() {
        return NOT_READY;
    }

    public static JobResult of(Job job) {
        if (!job.getStatus().isTerminal()) {
            return new JobResult(false, job.getStatus(), null, null, null);
        }
        return new JobResult(true, job.getStatus(), job.getResult(), job.getErrorType(), job.getErrorMessage());
    }

    public static JobResult of(JobOutcome outcome) {
        return new JobResult(true, outcome.status(), outcome.getResult(), outcome.getErrorType(), outcome.getErrorMessage());
    }

    public boolean isSuccess() {
        return ready && status == JobStatus.SUCCEEDED;
    }
}
