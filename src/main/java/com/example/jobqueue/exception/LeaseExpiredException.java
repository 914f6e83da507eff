package com.example.jobqueue.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * Recorded on a job whose worker lease ran out before it reported a result
 */
@Getter
public class LeaseExpiredException extends RuntimeException {

    private final String jobId;
    private final String workerId;

    public LeaseExpiredException(String jobId, String workerId, Instant leasedUntil) {
        super(String.format("Lease of job %s held by %s expired at %s", jobId, workerId, leasedUntil));
        this.jobId = jobId;
        this.workerId = workerId;
    }
}
