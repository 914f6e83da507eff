package com.example.jobqueue.worker;

import com.example.jobqueue.domain.enums.ExecutorKind;
import com.example.jobqueue.service.executor.JobExecutor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative lease loops sharing a single Reactor thread.
 * <p>
 * Retry delays and idle waits are timers on the scheduler, so loops interleave while
 * they wait. A job function that blocks holds the thread and starves every other loop.
 */
@Slf4j
public class FiberExecutionEngine implements ExecutionEngine {

    private final JobLeaser leaser;
    private final JobExecutor jobExecutor;
    private final int slots;
    private final AtomicBoolean leasing = new AtomicBoolean(false);
    private final List<Disposable> loops = new ArrayList<>();

    private Scheduler scheduler;
    private CountDownLatch finished;

    public FiberExecutionEngine(JobLeaser leaser, JobExecutor jobExecutor, int slots) {
        this.leaser = leaser;
        this.jobExecutor = jobExecutor;
        this.slots = slots;
    }

    @Override
    public ExecutorKind getKind() {
        return ExecutorKind.FIBER;
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
        scheduler = Schedulers.newSingle("job-fiber-" + leaser.getWorkerId());
        finished = new CountDownLatch(slots);
        leasing.set(true);
        for (var slot = 0; slot < slots; slot++) {
            var slotId = slot;
            loops.add(loop()
                    .subscribeOn(scheduler)
                    .doFinally(signal -> finished.countDown())
                    .subscribe(
                            ignored -> {
                            },
                            e -> log.error("Fiber slot {} of {} stopped: {}", slotId, leaser.getWorkerId(), e.getMessage(), e)));
        }
        log.info("Started fiber engine {} with {} slots", leaser.getWorkerId(), slots);
    }

    private Flux<Void> loop() {
        return Mono.defer(() -> {
                    if (!leasing.get()) {
                        return Mono.<Void>empty();
                    }
                    return leaser.leaseOnce()
                            .map(job -> jobExecutor.executeReactive(job, scheduler).then())
                            .orElseGet(() -> Mono.delay(leaser.getPollTimeout(), scheduler).then());
                })
                .onErrorResume(e -> {
                    log.error("Unexpected error in fiber slot of {}: {}", leaser.getWorkerId(), e.getMessage(), e);
                    return Mono.empty();
                })
                .repeat(leasing::get);
    }

    @Override
    public void stop(Duration gracePeriod) {
        if (!leasing.compareAndSet(true, false)) {
            return;
        }
        try {
            var wait = gracePeriod.plus(leaser.getPollTimeout());
            if (!finished.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Fiber jobs still running after {}, disposing them", gracePeriod);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            loops.forEach(Disposable::dispose);
            loops.clear();
            scheduler.dispose();
        }
        log.info("Stopped fiber engine {}", leaser.getWorkerId());
    }

    @Override
    public boolean isRunning() {
        return leasing.get();
    }
}
