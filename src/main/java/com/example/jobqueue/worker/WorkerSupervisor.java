package com.example.jobqueue.worker;

import com.example.jobqueue.config.JobQueueProperties;
import com.example.jobqueue.domain.enums.ExecutorKind;
import com.example.jobqueue.service.executor.JobMaintenanceService;
import com.example.jobqueue.service.schedule.ScheduleDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts and stops the worker pool of this node.
 * <p>
 * At most one pool runs at a time. Starting while running and stopping while
 * stopped only log a warning.
 */
@Slf4j
@Service
public class WorkerSupervisor implements DisposableBean {

    private final ExecutionEngineFactory engineFactory;
    private final ScheduleDispatcher scheduleDispatcher;
    private final JobMaintenanceService maintenanceService;
    private final JobQueueProperties properties;
    private final String hostname;

    private final AtomicInteger poolCounter = new AtomicInteger();
    private WorkerPool pool;
    private String instanceId;

    public WorkerSupervisor(ExecutionEngineFactory engineFactory, ScheduleDispatcher scheduleDispatcher,
                            JobMaintenanceService maintenanceService, JobQueueProperties properties,
                            @Value("${HOSTNAME:unknown}") String hostname) {
        this.engineFactory = engineFactory;
        this.scheduleDispatcher = scheduleDispatcher;
        this.maintenanceService = maintenanceService;
        this.properties = properties;
        this.hostname = hostname;
    }

    // === Start ===

    /**
     * Start a single-slot worker of the default kind.
     *
     * @param background false blocks until the worker is stopped
     */
    public void startWorker(boolean background) throws InterruptedException {
        startWorkerPool(1, defaultKind(), background, properties.getWorker().isWithScheduler());
    }

    /**
     * Start {@code numWorkers} slots of the default kind.
     */
    public void startWorkerPool(int numWorkers, boolean background) throws InterruptedException {
        startWorkerPool(numWorkers, defaultKind(), background, properties.getWorker().isWithScheduler());
    }

    /**
     * @param numWorkers    number of slots, capped by {@code max-concurrent-jobs}
     * @param withScheduler also dispatch due schedules from this pool
     * @param background    false blocks until the pool is stopped
     */
    public void startWorkerPool(int numWorkers, ExecutorKind kind, boolean background, boolean withScheduler)
            throws InterruptedException {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("numWorkers must be at least 1 but was " + numWorkers);
        }
        WorkerPool started;
        synchronized (this) {
            if (pool != null) {
                log.warn("Worker pool {} is already running", pool.getWorkerId());
                return;
            }
            var slots = Math.min(numWorkers, properties.getMaxConcurrentJobs());
            if (slots < numWorkers) {
                log.warn("Capping {} requested workers to max-concurrent-jobs {}", numWorkers, slots);
            }
            var workerId = getInstanceId() + "-" + poolCounter.incrementAndGet();
            started = new WorkerPool(workerId, engineFactory.create(kind, slots, workerId), withScheduler,
                    scheduleDispatcher, maintenanceService, properties.getSchedulerInterval(),
                    properties.getCleanupInterval());
            started.start();
            pool = started;
        }
        if (!background) {
            started.awaitStop();
        }
    }

    // === Stop ===

    public void stopWorker() {
        stopWorkerPool();
    }

    public void stopWorkerPool() {
        WorkerPool stopping;
        synchronized (this) {
            stopping = pool;
            pool = null;
        }
        if (stopping == null) {
            log.warn("No worker pool is running");
            return;
        }
        stopping.stop(properties.getShutdownGracePeriod());
    }

    public synchronized boolean isRunning() {
        return pool != null;
    }

    public synchronized Optional<WorkerPool> currentPool() {
        return Optional.ofNullable(pool);
    }

    @Override
    public void destroy() {
        if (isRunning()) {
            stopWorkerPool();
        }
    }

    private ExecutorKind defaultKind() {
        return ExecutorKind.fromValue(properties.getDefaultJobExecutor());
    }

    /**
     * Get unique instance ID for this node
     */
    private String getInstanceId() {
        if (instanceId == null) {
            try {
                var host = InetAddress.getLocalHost().getHostName();
                instanceId = host + "-" + ProcessHandle.current().pid();
            } catch (Exception e) {
                instanceId = hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
            }
        }
        return instanceId;
    }
}
