package com.example.jobqueue.domain.model;

import com.example.jobqueue.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit of work: a registered function name plus its arguments, the queue it
 * waits on and everything learned while running it.
 * <p>
 * Stores hand out copies, so mutating a Job never changes persisted state until
 * it is saved again.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    private String id;

    private String function;

    @Builder.Default
    private List<Object> args = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> kwargs = new LinkedHashMap<>();

    private String queue;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    private Instant createdAt;

    /**
     * Earliest execution time; null means eligible immediately
     */
    private Instant scheduledFor;

    private Instant startedAt;

    private Instant finishedAt;

    /**
     * How long a successful result is kept after the job finished
     */
    private Duration resultTtl;

    private Instant expiresAt;

    private Object result;

    private String errorType;

    private String errorMessage;

    private String errorStackTrace;

    @Builder.Default
    private int attempts = 0;

    private RetrySettings retry;

    /**
     * Set when the job was emitted by a schedule
     */
    private String scheduleId;

    private String workerId;

    private Instant leasedUntil;

    /**
     * Submission order assigned by the store
     */
    private long sequence;

    public boolean isDue(Instant now) {
        return scheduledFor == null || !scheduledFor.isAfter(now);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isLeaseExpired(Instant now) {
        return status == JobStatus.RUNNING && leasedUntil != null && leasedUntil.isBefore(now);
    }

    public void markRunning(String workerId, Instant now, Instant leaseUntil) {
        this.status = JobStatus.RUNNING;
        this.workerId = workerId;
        this.startedAt = now;
        this.leasedUntil = leaseUntil;
    }

    public void markSucceeded(Object result, Instant now) {
        this.status = JobStatus.SUCCEEDED;
        this.result = result;
        this.finishedAt = now;
        this.leasedUntil = null;
        this.errorType = null;
        this.errorMessage = null;
        this.errorStackTrace = null;
        this.expiresAt = resultTtl != null ? now.plus(resultTtl) : null;
    }

    public void markFailed(String errorType, String errorMessage, String errorStackTrace, Instant now) {
        this.status = JobStatus.FAILED;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.errorStackTrace = errorStackTrace;
        this.finishedAt = now;
        this.leasedUntil = null;
    }

    public void markCancelled(Instant now) {
        this.status = JobStatus.CANCELLED;
        this.finishedAt = now;
        this.leasedUntil = null;
    }

    public Job copy() {
        return toBuilder()
                .args(args == null ? new ArrayList<>() : new ArrayList<>(args))
                .kwargs(kwargs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(kwargs))
                .retry(retry == null ? null : retry.copy())
                .build();
    }
}
