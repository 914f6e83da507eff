package com.example.jobqueue.worker.process;

import com.example.jobqueue.config.MetricsConfig;
import com.example.jobqueue.domain.enums.ExecutorKind;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.exception.BackendOperationException;
import com.example.jobqueue.exception.UnknownJobFunctionException;
import com.example.jobqueue.exception.WorkerProcessException;
import com.example.jobqueue.service.executor.JobExecutor;
import com.example.jobqueue.service.executor.JobOutcome;
import com.example.jobqueue.service.function.JobFunctionRegistry;
import com.example.jobqueue.store.JsonCodec;
import com.example.jobqueue.worker.ExecutionEngine;
import com.example.jobqueue.worker.JobLeaser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ClassUtils;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One child JVM per slot. The parent leases and records; the child only runs the
 * function, so it never holds a backend connection.
 * <p>
 * A child that dies or garbles a response fails the job it was running with a
 * {@link WorkerProcessException} and is replaced before the slot leases again.
 */
@Slf4j
public class ProcessExecutionEngine implements ExecutionEngine {

    private final JobLeaser leaser;
    private final JobExecutor jobExecutor;
    private final JobFunctionRegistry functionRegistry;
    private final WorkerProcessLauncher launcher;
    private final JsonCodec jsonCodec;
    private final MetricsConfig metricsConfig;
    private final int slots;

    private final AtomicBoolean leasing = new AtomicBoolean(false);
    private final List<Thread> slotThreads = new ArrayList<>();
    private final Map<Integer, WorkerProcess> processes = new ConcurrentHashMap<>();

    public ProcessExecutionEngine(JobLeaser leaser, JobExecutor jobExecutor, JobFunctionRegistry functionRegistry,
                                  WorkerProcessLauncher launcher, JsonCodec jsonCodec, MetricsConfig metricsConfig,
                                  int slots) {
        this.leaser = leaser;
        this.jobExecutor = jobExecutor;
        this.functionRegistry = functionRegistry;
        this.launcher = launcher;
        this.jsonCodec = jsonCodec;
        this.metricsConfig = metricsConfig;
        this.slots = slots;
    }

    @Override
    public ExecutorKind getKind() {
        return ExecutorKind.PROCESS;
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
        leasing.set(true);
        for (var slot = 0; slot < slots; slot++) {
            var slotId = slot;
            var thread = new Thread(() -> slotLoop(slotId), "job-process-slot-" + slot);
            thread.setDaemon(true);
            slotThreads.add(thread);
            thread.start();
        }
        log.info("Started process engine {} with {} slots", leaser.getWorkerId(), slots);
    }

    private void slotLoop(int slot) {
        while (leasing.get()) {
            try {
                var process = ensureProcess(slot);
                if (process == null) {
                    Thread.sleep(leaser.getPollTimeout().toMillis());
                    continue;
                }
                var job = leaser.leaseOrWait();
                if (job.isPresent()) {
                    runInChild(slot, process, job.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Unexpected error in process slot {}: {}", slot, e.getMessage(), e);
            }
        }
    }

    private WorkerProcess ensureProcess(int slot) {
        var process = processes.get(slot);
        if (process != null && process.isAlive()) {
            return process;
        }
        if (process != null) {
            log.warn("Worker process in slot {} died, replacing it", slot);
        }
        try {
            process = launcher.launch(slot);
            processes.put(slot, process);
            return process;
        } catch (IOException e) {
            log.error("Could not start worker process for slot {}: {}", slot, e.getMessage(), e);
            processes.remove(slot);
            return null;
        }
    }

    private void runInChild(int slot, WorkerProcess process, Job job) {
        var timerSample = metricsConfig.startJobExecutionTimer();
        JobOutcome outcome;
        try {
            var request = toRequest(job);
            process.send(jsonCodec.write(request));
            var line = process.receive();
            if (line == null) {
                throw new WorkerProcessException(slot, "exited while running job " + job.getId());
            }
            var response = jsonCodec.read(line, ProcessJobResponse.class);
            outcome = response.isSuccess()
                    ? JobOutcome.success(response.getResult(), response.getAttempts())
                    : JobOutcome.failure(response.getErrorType(), response.getErrorMessage(),
                    response.getErrorStackTrace(), response.getAttempts());
        } catch (UnknownJobFunctionException e) {
            outcome = JobOutcome.failure(e, 1);
        } catch (IOException | BackendOperationException | WorkerProcessException e) {
            var error = e instanceof WorkerProcessException
                    ? (WorkerProcessException) e
                    : new WorkerProcessException(slot, "failed while running job " + job.getId(), e);
            log.error("{}, failing the job", error.getMessage());
            process.destroy();
            processes.remove(slot);
            outcome = JobOutcome.failure(error, 1);
        }
        jobExecutor.record(job, outcome, timerSample);
    }

    private ProcessJobRequest toRequest(Job job) {
        var function = functionRegistry.getFunctionOrThrow(job.getFunction());
        return ProcessJobRequest.builder()
                .jobId(job.getId())
                .function(job.getFunction())
                .functionClass(ClassUtils.getUserClass(function).getName())
                .args(job.getArgs())
                .kwargs(job.getKwargs())
                .retry(job.getRetry())
                .build();
    }

    @Override
    public void stop(Duration gracePeriod) {
        if (!leasing.compareAndSet(true, false)) {
            return;
        }
        var deadline = System.nanoTime() + gracePeriod.plus(leaser.getPollTimeout()).toNanos();
        try {
            for (var thread : slotThreads) {
                var remaining = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
                thread.join(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        var stuck = slotThreads.stream().filter(Thread::isAlive).count();
        if (stuck > 0) {
            log.warn("{} process slots still busy after {}, killing their workers", stuck, gracePeriod);
            processes.values().forEach(WorkerProcess::destroy);
            slotThreads.forEach(Thread::interrupt);
        } else {
            processes.values().forEach(process -> process.shutdown(Duration.ofSeconds(5)));
        }
        processes.clear();
        slotThreads.clear();
        log.info("Stopped process engine {}", leaser.getWorkerId());
    }

    @Override
    public boolean isRunning() {
        return leasing.get();
    }
}
