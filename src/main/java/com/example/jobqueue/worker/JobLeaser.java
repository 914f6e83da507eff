package com.example.jobqueue.worker;

import com.example.jobqueue.backend.event.JobEventBroker;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.exception.BackendOperationException;
import com.example.jobqueue.store.JobStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Leases jobs for one worker. Backend failures are logged and reported as
 * "nothing to do" so lease loops keep running.
 * <p>
 * Leased ids are remembered until a renewal finds the job settled, so jobs running
 * longer than the lease duration keep their lease while this worker is alive.
 */
@Slf4j
public class JobLeaser {

    private final JobStore jobStore;
    private final JobEventBroker eventBroker;
    private final List<String> queues;
    private final Duration leaseDuration;
    @Getter
    private final Duration pollTimeout;
    @Getter
    private final String workerId;
    private final Clock clock;
    private final Set<String> held = ConcurrentHashMap.newKeySet();

    public JobLeaser(JobStore jobStore, JobEventBroker eventBroker, List<String> queues, Duration leaseDuration,
                     Duration pollTimeout, String workerId, Clock clock) {
        this.jobStore = jobStore;
        this.eventBroker = eventBroker;
        this.queues = List.copyOf(queues);
        this.leaseDuration = leaseDuration;
        this.pollTimeout = pollTimeout;
        this.workerId = workerId;
        this.clock = clock;
    }

    /**
     * Try once, never blocks beyond the store call.
     */
    public Optional<Job> leaseOnce() {
        var now = clock.instant();
        try {
            var job = jobStore.lease(queues, workerId, now, now.plus(leaseDuration));
            job.ifPresent(j -> {
                held.add(j.getId());
                log.debug("Worker {} leased job {} from queue {}", workerId, j.getId(), j.getQueue());
            });
            return job;
        } catch (BackendOperationException e) {
            log.error("Worker {} could not lease a job: {}", workerId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Try once; when nothing is available wait up to the poll timeout for an
     * enqueue notification before returning empty.
     */
    public Optional<Job> leaseOrWait() throws InterruptedException {
        var job = leaseOnce();
        if (job.isEmpty()) {
            eventBroker.await(pollTimeout);
        }
        return job;
    }

    /**
     * Extend the lease of every job this worker still runs by a full lease duration.
     * Jobs that finished, were cancelled or were taken over are forgotten.
     *
     * @return number of renewed leases
     */
    public int renewLeases() {
        var leaseUntil = clock.instant().plus(leaseDuration);
        var renewed = 0;
        for (var jobId : held) {
            try {
                if (jobStore.renewLease(jobId, workerId, leaseUntil)) {
                    renewed++;
                } else {
                    held.remove(jobId);
                }
            } catch (BackendOperationException e) {
                log.error("Worker {} could not renew the lease of job {}: {}", workerId, jobId, e.getMessage(), e);
            }
        }
        if (renewed > 0) {
            log.debug("Worker {} renewed {} leases until {}", workerId, renewed, leaseUntil);
        }
        return renewed;
    }

    /**
     * How often {@link #renewLeases} should run: a third of the lease duration.
     */
    public Duration getRenewInterval() {
        return leaseDuration.dividedBy(3);
    }

    public Set<String> getHeldJobIds() {
        return Set.copyOf(held);
    }
}
