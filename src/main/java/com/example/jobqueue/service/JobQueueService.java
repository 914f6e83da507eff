package com.example.jobqueue.service;

import com.example.jobqueue.backend.event.JobEventBroker;
import com.example.jobqueue.config.MetricsConfig;
import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.exception.InvalidJobStateException;
import com.example.jobqueue.exception.JobFailedException;
import com.example.jobqueue.exception.JobNotFoundException;
import com.example.jobqueue.exception.UnsupportedBackendOperationException;
import com.example.jobqueue.service.executor.JobCompletionTracker;
import com.example.jobqueue.service.executor.JobOutcome;
import com.example.jobqueue.service.function.JobFunctionRegistry;
import com.example.jobqueue.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for submitting and managing jobs.
 * <p>
 * Provides operations for:
 * - Submitting jobs for immediate or delayed execution
 * - Running a job and waiting for its result
 * - Querying jobs and results
 * - Cancelling, deleting and requeueing jobs
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueueService {

    private final JobStore jobStore;
    private final JobFunctionRegistry functionRegistry;
    private final SettingsResolver settingsResolver;
    private final JobCompletionTracker completionTracker;
    private final JobEventBroker eventBroker;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    // === Submission ===

    /**
     * Submit a job.
     *
     * @return the job id
     * @throws com.example.jobqueue.exception.UnknownJobFunctionException if the function is not registered
     * @throws IllegalArgumentException if a job with the requested id already exists
     */
    public String addJob(JobSubmission submission) {
        return enqueue(submission).getId();
    }

    /**
     * Submit a job and block until it is terminal.
     *
     * @return the job result
     * @throws JobFailedException if the job failed or was cancelled
     */
    public Object runJob(JobSubmission submission) throws InterruptedException {
        var jobId = submission.getJobId() != null ? submission.getJobId() : newJobId();
        // Registered before enqueue so a fast worker cannot complete unobserved
        completionTracker.register(jobId);
        try {
            enqueue(submission.toBuilder().jobId(jobId).build());
        } catch (RuntimeException e) {
            completionTracker.forget(jobId);
            throw e;
        }

        var outcome = completionTracker.await(jobId);
        if (outcome.isSuccess()) {
            return outcome.getResult();
        }
        if (outcome.getError() != null) {
            throw new JobFailedException(jobId, outcome.getError());
        }
        throw new JobFailedException(jobId, outcome.getErrorType(), outcome.getErrorMessage(), outcome.getErrorStackTrace());
    }

    private Job enqueue(JobSubmission submission) {
        functionRegistry.getFunctionOrThrow(submission.getFunction());

        var jobId = submission.getJobId() != null ? submission.getJobId() : newJobId();
        if (jobStore.findJob(jobId).isPresent()) {
            throw new IllegalArgumentException("Job already exists: " + jobId);
        }

        var now = clock.instant();
        var retry = settingsResolver.resolveRetry(submission.getRetry(), null);
        // Fail on unknown retryable types at submission rather than at execution
        SettingsResolver.toPolicy(retry);

        var job = Job.builder()
                .id(jobId)
                .function(submission.getFunction())
                .args(submission.getArgs() != null ? new ArrayList<>(submission.getArgs()) : new ArrayList<>())
                .kwargs(submission.getKwargs() != null ? new LinkedHashMap<>(submission.getKwargs()) : new LinkedHashMap<>())
                .queue(settingsResolver.resolveQueue(submission.getQueue(), null))
                .status(JobStatus.PENDING)
                .createdAt(now)
                .scheduledFor(resolveStartTime(submission, now))
                .resultTtl(settingsResolver.resolveResultTtl(submission.getResultTtl(), null))
                .retry(retry)
                .scheduleId(submission.getScheduleId())
                .build();

        var stored = jobStore.enqueue(job);
        log.info("Enqueued job {} (function: {}, queue: {}, scheduled for: {})", stored.getId(), stored.getFunction(),
                stored.getQueue(), stored.getScheduledFor() != null ? stored.getScheduledFor() : "now");

        metricsConfig.recordJobSubmitted(stored.getQueue());
        eventBroker.publish(stored.getQueue());
        return stored;
    }

    private Instant resolveStartTime(JobSubmission submission, Instant now) {
        if (submission.getRunAt() != null) {
            return submission.getRunAt();
        }
        if (submission.getRunIn() != null) {
            return now.plus(submission.getRunIn());
        }
        return null;
    }

    private static String newJobId() {
        return UUID.randomUUID().toString();
    }

    // === Queries ===

    public Optional<Job> getJob(String jobId) {
        return jobStore.findJob(jobId);
    }

    public List<Job> getJobs(String queue) {
        return jobStore.findJobs(queue);
    }

    public List<String> jobIds() {
        return jobStore.jobIds();
    }

    /**
     * Get the result of a job.
     *
     * @param wait block until the job is terminal
     * @throws JobNotFoundException if the job does not exist
     */
    public JobResult getJobResult(String jobId, boolean wait) throws InterruptedException {
        var job = jobStore.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getStatus().isTerminal() || !wait) {
            return JobResult.of(job);
        }
        var outcome = completionTracker.await(jobId);
        return jobStore.findJob(jobId)
                .filter(stored -> stored.getStatus().isTerminal())
                .map(JobResult::of)
                .orElseGet(() -> JobResult.of(outcome));
    }

    // === Cancellation and deletion ===

    /**
     * Cancel a pending or running job. A running job is not interrupted; its result
     * is discarded when it finishes.
     *
     * @return false if the job is unknown or already terminal
     */
    public boolean cancelJob(String jobId) {
        requireCapability(jobStore.capabilities().isJobCancellation(), "job cancellation");

        var cancelled = jobStore.cancelJob(jobId, clock.instant());
        cancelled.ifPresent(job -> {
            log.info("Cancelled job {}", jobId);
            metricsConfig.recordJobCancelled(job.getQueue());
            completionTracker.complete(jobId, JobOutcome.cancelled());
        });
        return cancelled.isPresent();
    }

    public boolean deleteJob(String jobId) {
        requireCapability(jobStore.capabilities().isJobDeletion(), "job deletion");

        var deleted = jobStore.deleteJob(jobId);
        if (deleted) {
            log.info("Deleted job {}", jobId);
        }
        return deleted;
    }

    /**
     * Cancel every non-terminal job, optionally only on one queue.
     *
     * @return number of cancelled jobs
     */
    public int cancelAllJobs(String queue) {
        var count = 0;
        for (var job : jobStore.findJobs(queue)) {
            if (job.getStatus().isCancellable() && cancelJob(job.getId())) {
                count++;
            }
        }
        log.info("Cancelled {} jobs{}", count, queue != null ? " on queue " + queue : "");
        return count;
    }

    /**
     * @return number of deleted jobs
     */
    public int deleteAllJobs(String queue) {
        var count = 0;
        for (var job : jobStore.findJobs(queue)) {
            if (deleteJob(job.getId())) {
                count++;
            }
        }
        log.info("Deleted {} jobs{}", count, queue != null ? " on queue " + queue : "");
        return count;
    }

    /**
     * Put a FAILED or CANCELLED job back on its queue under the same id.
     *
     * @param runAt earliest start, null for now
     * @throws InvalidJobStateException if the job is not FAILED or CANCELLED
     */
    public Job requeueJob(String jobId, Instant runAt) {
        var job = jobStore.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getStatus() != JobStatus.FAILED && job.getStatus() != JobStatus.CANCELLED) {
            throw new InvalidJobStateException(jobId, job.getStatus().name(), JobStatus.PENDING.name());
        }

        var fresh = Job.builder()
                .id(job.getId())
                .function(job.getFunction())
                .args(job.getArgs())
                .kwargs(job.getKwargs())
                .queue(job.getQueue())
                .status(JobStatus.PENDING)
                .createdAt(clock.instant())
                .scheduledFor(runAt)
                .resultTtl(job.getResultTtl())
                .retry(job.getRetry())
                .scheduleId(job.getScheduleId())
                .build();

        jobStore.deleteJob(jobId);
        var stored = jobStore.enqueue(fresh);
        log.info("Requeued job {} on queue {}", jobId, stored.getQueue());
        eventBroker.publish(stored.getQueue());
        return stored;
    }

    private void requireCapability(boolean supported, String operation) {
        if (!supported) {
            throw new UnsupportedBackendOperationException(jobStore.getType().getTag(), operation);
        }
    }
}
