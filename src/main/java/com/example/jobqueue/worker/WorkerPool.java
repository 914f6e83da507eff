package com.example.jobqueue.worker;

import com.example.jobqueue.service.executor.JobMaintenanceService;
import com.example.jobqueue.service.schedule.ScheduleDispatcher;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * A started execution engine plus its maintenance ticks: schedule dispatch, result
 * purge and lease recovery, and renewal of the leases its jobs hold.
 */
@Slf4j
public class WorkerPool {

    @Getter
    private final String workerId;
    @Getter
    private final ExecutionEngine engine;
    @Getter
    private final boolean withScheduler;
    private final ScheduleDispatcher scheduleDispatcher;
    private final JobMaintenanceService maintenanceService;
    private final Duration schedulerInterval;
    private final Duration cleanupInterval;

    private final CountDownLatch stopped = new CountDownLatch(1);
    private ThreadPoolTaskScheduler ticker;

    public WorkerPool(String workerId, ExecutionEngine engine, boolean withScheduler,
                      ScheduleDispatcher scheduleDispatcher, JobMaintenanceService maintenanceService,
                      Duration schedulerInterval, Duration cleanupInterval) {
        this.workerId = workerId;
        this.engine = engine;
        this.withScheduler = withScheduler;
        this.scheduleDispatcher = scheduleDispatcher;
        this.maintenanceService = maintenanceService;
        this.schedulerInterval = schedulerInterval;
        this.cleanupInterval = cleanupInterval;
    }

    public void start() {
        engine.start();

        ticker = new ThreadPoolTaskScheduler();
        ticker.setPoolSize(withScheduler ? 3 : 2);
        ticker.setThreadNamePrefix("job-tick-");
        ticker.setDaemon(true);
        ticker.initialize();
        if (withScheduler) {
            ticker.scheduleWithFixedDelay(scheduleDispatcher::dispatchWithLock, schedulerInterval);
        }
        ticker.scheduleWithFixedDelay(maintenanceService::runMaintenance, cleanupInterval);
        var leaser = engine.getLeaser();
        ticker.scheduleWithFixedDelay(leaser::renewLeases, leaser.getRenewInterval());

        log.info("Worker pool {} started: {} x {}{}", workerId, engine.getSlots(), engine.getKind(),
                withScheduler ? " with scheduler" : "");
    }

    public void stop(Duration gracePeriod) {
        log.info("Stopping worker pool {}", workerId);
        if (ticker != null) {
            ticker.shutdown();
        }
        engine.stop(gracePeriod);
        stopped.countDown();
    }

    /**
     * Block until {@link #stop} completed.
     */
    public void awaitStop() throws InterruptedException {
        stopped.await();
    }

    public boolean isRunning() {
        return engine.isRunning();
    }
}
