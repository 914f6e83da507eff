package com.example.jobqueue.store;

import com.example.jobqueue.backend.BackendType;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.domain.model.Schedule;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence and leasing contract shared by every backend.
 * <p>
 * Broker backends keep queues plus a delayed set and lease by popping; data-store
 * backends keep rows with a {@code scheduledFor} column and lease with an atomic
 * conditional update. Callers cannot tell the difference.
 * <p>
 * All methods may throw {@link com.example.jobqueue.exception.BackendOperationException}
 * when the backend is unreachable.
 */
public interface JobStore {

    BackendType getType();

    BackendCapabilities capabilities();

    /**
     * Create tables, indexes or whatever the backend needs. Idempotent.
     */
    default void initialize() {
    }

    // === Jobs ===

    /**
     * Insert a new pending job, assigning its submission sequence.
     */
    Job enqueue(Job job);

    /**
     * Persist changes to an existing job.
     */
    void update(Job job);

    Optional<Job> findJob(String id);

    /**
     * Jobs in submission order, optionally limited to one queue.
     */
    List<Job> findJobs(String queue);

    List<String> jobIds();

    /**
     * Atomically take the oldest due pending job from the given queues and mark it
     * RUNNING for {@code workerId} until {@code leaseUntil}. Never blocks.
     */
    Optional<Job> lease(Collection<String> queues, String workerId, Instant now, Instant leaseUntil);

    /**
     * Record the terminal state of a leased job, unless it was cancelled meanwhile.
     *
     * @return false when the stored job is no longer RUNNING and nothing was written
     */
    boolean finish(Job job);

    /**
     * Cancel a job unless it already finished.
     *
     * @return the cancelled job, empty when unknown or terminal
     */
    Optional<Job> cancelJob(String id, Instant now);

    boolean deleteJob(String id);

    /**
     * Delete finished jobs whose result retention ran out.
     *
     * @return number of removed jobs
     */
    int purgeExpiredResults(Instant now);

    /**
     * RUNNING jobs whose lease ended before {@code now}.
     */
    List<Job> findExpiredLeases(Instant now);

    /**
     * Push the lease end of a job still held by {@code workerId} to {@code leaseUntil}.
     *
     * @return false when the job is gone, no longer RUNNING or leased by another worker
     */
    boolean renewLease(String id, String workerId, Instant leaseUntil);

    /**
     * Put back on their queue the pending jobs a worker took off a queue but never
     * leased because it died in between. Only broker backends can strand jobs this way.
     *
     * @return number of requeued jobs
     */
    default int recoverStrandedJobs() {
        return 0;
    }

    // === Schedules ===

    void saveSchedule(Schedule schedule);

    /**
     * Replace a schedule only if the stored one still has the state of {@code expected}
     * (see {@link Schedule#hasSameStateAs}).
     *
     * @return false when the schedule was deleted or changed since {@code expected} was read
     */
    boolean replaceSchedule(Schedule expected, Schedule updated);

    Optional<Schedule> findSchedule(String id);

    List<Schedule> findSchedules();

    List<String> scheduleIds();

    boolean deleteSchedule(String id);

    /**
     * Active, unpaused schedules whose next fire time is at or before {@code now}.
     */
    List<Schedule> findDueSchedules(Instant now);
}
