package com.example.jobqueue.service.executor;

import com.example.jobqueue.config.MetricsConfig;
import com.example.jobqueue.exception.LeaseExpiredException;
import com.example.jobqueue.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic housekeeping run by worker pools:
 * - Purge results whose retention ran out (backends without native expiry)
 * - Fail jobs whose worker lease expired
 * - Requeue jobs stranded between dequeue and lease
 */
@Slf4j
@Service
public class JobMaintenanceService {

    static final String LOCK_NAME = "jobQueueMaintenance";

    private final JobStore jobStore;
    private final JobCompletionTracker completionTracker;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public JobMaintenanceService(JobStore jobStore, JobCompletionTracker completionTracker,
                                 LockingTaskExecutor lockingTaskExecutor, MetricsConfig metricsConfig, Clock clock) {
        this.jobStore = jobStore;
        this.completionTracker = completionTracker;
        this.lockingTaskExecutor = lockingTaskExecutor;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Maintenance tick. Runs on one node at a time.
     */
    public void runMaintenance() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous maintenance cycle still running, skipping");
            return;
        }
        try {
            lockingTaskExecutor.executeWithLock((Runnable) () -> {
                purgeExpiredResults();
                recoverExpiredLeases();
                recoverStrandedJobs();
            }, new LockConfiguration(clock.instant(), LOCK_NAME, Duration.ofMinutes(10), Duration.ZERO));
        } catch (RuntimeException e) {
            log.error("Error in maintenance cycle: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * @return number of purged jobs
     */
    public int purgeExpiredResults() {
        var purged = jobStore.purgeExpiredResults(clock.instant());
        if (purged > 0) {
            log.info("Purged {} jobs with expired results", purged);
        }
        return purged;
    }

    /**
     * @return number of requeued jobs
     */
    public int recoverStrandedJobs() {
        var restored = jobStore.recoverStrandedJobs();
        if (restored > 0) {
            log.warn("Requeued {} jobs left behind by a worker that stopped mid-lease", restored);
        }
        return restored;
    }

    /**
     * Mark RUNNING jobs whose lease expired as FAILED.
     *
     * @return number of recovered jobs
     */
    public int recoverExpiredLeases() {
        var now = clock.instant();
        var recovered = 0;
        for (var job : jobStore.findExpiredLeases(now)) {
            var error = new LeaseExpiredException(job.getId(), job.getWorkerId(), job.getLeasedUntil());
            job.markFailed(error.getClass().getName(), error.getMessage(), null, now);
            if (jobStore.finish(job)) {
                log.warn("{}, marked as failed", error.getMessage());
                metricsConfig.recordLeaseExpired();
                completionTracker.complete(job.getId(), JobOutcome.fromJob(job));
                recovered++;
            }
        }
        return recovered;
    }
}
