package com.example.jobqueue.worker;

import com.example.jobqueue.domain.enums.ExecutorKind;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.service.executor.JobExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One lease loop feeding a fixed pool of threads.
 * <p>
 * The loop only leases once a slot is free, so a leased job never waits in a local
 * queue where another node could have run it.
 */
@Slf4j
public class ThreadExecutionEngine implements ExecutionEngine {

    private final JobLeaser leaser;
    private final JobExecutor jobExecutor;
    private final int slots;
    private final Semaphore freeSlots;
    private final AtomicBoolean leasing = new AtomicBoolean(false);

    private ThreadPoolTaskExecutor executor;
    private Thread leaseThread;

    public ThreadExecutionEngine(JobLeaser leaser, JobExecutor jobExecutor, int slots) {
        this.leaser = leaser;
        this.jobExecutor = jobExecutor;
        this.slots = slots;
        this.freeSlots = new Semaphore(slots);
    }

    @Override
    public ExecutorKind getKind() {
        return ExecutorKind.THREAD;
    }

    @Override
    public int getSlots() {
        return slots;
    }

    @Override
    public JobLeaser getLeaser() {
        return leaser;
    }

    @Override
    public synchronized void start() {
        if (leasing.get()) {
            return;
        }
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(slots);
        executor.setMaxPoolSize(slots);
        executor.setQueueCapacity(slots);
        executor.setThreadNamePrefix("job-worker-");
        executor.initialize();

        leasing.set(true);
        leaseThread = new Thread(this::leaseLoop, "job-lease-" + leaser.getWorkerId());
        leaseThread.setDaemon(true);
        leaseThread.start();
        log.info("Started thread engine {} with {} slots", leaser.getWorkerId(), slots);
    }

    private void leaseLoop() {
        var slotWait = leaser.getPollTimeout().toMillis();
        while (leasing.get()) {
            try {
                if (!freeSlots.tryAcquire(slotWait, TimeUnit.MILLISECONDS)) {
                    continue;
                }
                var job = leaser.leaseOrWait();
                if (job.isEmpty()) {
                    freeSlots.release();
                    continue;
                }
                dispatch(job.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Lease loop of {} stopped", leaser.getWorkerId());
    }

    private void dispatch(Job job) {
        try {
            executor.execute(() -> {
                try {
                    jobExecutor.execute(job);
                } catch (RuntimeException e) {
                    log.error("Unexpected error executing job {}: {}", job.getId(), e.getMessage(), e);
                } finally {
                    freeSlots.release();
                }
            });
        } catch (TaskRejectedException e) {
            freeSlots.release();
            log.warn("Job {} was leased during shutdown and will be recovered when its lease expires", job.getId());
        }
    }

    @Override
    public void stop(Duration gracePeriod) {
        if (!leasing.compareAndSet(true, false)) {
            return;
        }
        try {
            leaseThread.join(leaser.getPollTimeout().multipliedBy(2).toMillis() + 1000);
            if (leaseThread.isAlive()) {
                leaseThread.interrupt();
            }

            var pool = executor.getThreadPoolExecutor();
            pool.shutdown();
            if (!pool.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Jobs still running after {}, interrupting them", gracePeriod);
                pool.shutdownNow();
                pool.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.getThreadPoolExecutor().shutdownNow();
        }
        log.info("Stopped thread engine {}", leaser.getWorkerId());
    }

    @Override
    public boolean isRunning() {
        return leasing.get();
    }
}
