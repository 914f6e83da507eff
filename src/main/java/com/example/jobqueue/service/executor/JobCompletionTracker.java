package com.example.jobqueue.service.executor;

import com.example.jobqueue.config.JobQueueProperties;
import com.example.jobqueue.exception.JobNotFoundException;
import com.example.jobqueue.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Lets callers block until a job is terminal.
 * <p>
 * Jobs executed in this JVM complete their waiter directly. Jobs finished elsewhere
 * (another node, a child process, a cancel) are noticed by polling the store every
 * {@code result-poll-interval}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobCompletionTracker {

    private final JobStore jobStore;
    private final JobQueueProperties properties;

    private final Map<String, CompletableFuture<JobOutcome>> waiters = new ConcurrentHashMap<>();

    /**
     * Register interest before the job can possibly finish, so a fast completion is not missed
     */
    public CompletableFuture<JobOutcome> register(String jobId) {
        return waiters.computeIfAbsent(jobId, id -> new CompletableFuture<>());
    }

    public void complete(String jobId, JobOutcome outcome) {
        var waiter = waiters.remove(jobId);
        if (waiter != null) {
            waiter.complete(outcome);
        }
    }

    public void forget(String jobId) {
        waiters.remove(jobId);
    }

    /**
     * Block until the job is terminal
     *
     * @throws JobNotFoundException if the job disappears while waiting
     */
    public JobOutcome await(String jobId) throws InterruptedException {
        var waiter = register(jobId);
        var pollMillis = Math.max(1, properties.getResultPollInterval().toMillis());
        try {
            while (true) {
                try {
                    return waiter.get(pollMillis, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    var job = jobStore.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
                    if (job.getStatus().isTerminal()) {
                        log.debug("Job {} observed terminal in store: {}", jobId, job.getStatus());
                        return JobOutcome.fromJob(job);
                    }
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Completion of job " + jobId + " failed", e.getCause());
                }
            }
        } finally {
            waiters.remove(jobId, waiter);
        }
    }

    int pendingWaiters() {
        return waiters.size();
    }
}
