package com.example.jobqueue.service.executor;

import com.example.jobqueue.config.MetricsConfig;
import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.exception.BackendOperationException;
import com.example.jobqueue.exception.UnknownJobFunctionException;
import com.example.jobqueue.retry.RetryExecutor;
import com.example.jobqueue.retry.RetryListener;
import com.example.jobqueue.service.SettingsResolver;
import com.example.jobqueue.service.function.JobFunctionRegistry;
import com.example.jobqueue.store.JobStore;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Service responsible for executing individual leased jobs.
 * <p>
 * Handles:
 * - Function lookup
 * - Invocation under the job's retry policy
 * - Recording the terminal state, unless the job was cancelled meanwhile
 * - Waking local waiters
 * - Metrics recording
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobExecutor {

    private final JobStore jobStore;
    private final JobFunctionRegistry functionRegistry;
    private final RetryExecutor retryExecutor;
    private final JobCompletionTracker completionTracker;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Execute a leased job in the calling thread with full lifecycle management.
     *
     * @param job a job in RUNNING state leased by the caller
     * @return the outcome that was recorded
     */
    public JobOutcome execute(Job job) {
        log.info("Starting execution of job {} (function: {}, queue: {})", job.getId(), job.getFunction(), job.getQueue());

        var timerSample = metricsConfig.startJobExecutionTimer();
        var attempts = new AtomicInteger();
        JobOutcome outcome;
        try {
            var function = functionRegistry.getFunctionOrThrow(job.getFunction());
            var policy = SettingsResolver.toPolicy(job.getRetry());
            var result = retryExecutor.execute("job " + job.getId(), policy, () -> {
                attempts.incrementAndGet();
                return function.run(job.getArgs(), job.getKwargs());
            }, retryListener(job));
            outcome = JobOutcome.success(result, attempts.get());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Job {} failed after {} attempts: {}", job.getId(), attempts.get(), e.getMessage(), e);
            outcome = JobOutcome.failure(e, Math.max(1, attempts.get()));
        }
        return record(job, outcome, timerSample);
    }

    /**
     * Reactive variant for fiber slots: retry delays are scheduled on {@code scheduler}
     * instead of blocking the thread.
     */
    public Mono<JobOutcome> executeReactive(Job job, Scheduler scheduler) {
        return Mono.defer(() -> {
            log.info("Starting execution of job {} (function: {}, queue: {})", job.getId(), job.getFunction(), job.getQueue());
            var timerSample = metricsConfig.startJobExecutionTimer();
            var attempts = new AtomicInteger();

            var function = functionRegistry.getFunction(job.getFunction()).orElse(null);
            if (function == null) {
                var error = new UnknownJobFunctionException(job.getFunction());
                return Mono.just(record(job, JobOutcome.failure(error, 1), timerSample));
            }
            var policy = SettingsResolver.toPolicy(job.getRetry());

            return Mono.fromCallable(() -> {
                        attempts.incrementAndGet();
                        return Optional.ofNullable(function.run(job.getArgs(), job.getKwargs()));
                    })
                    .retryWhen(retryExecutor.reactiveRetry("job " + job.getId(), policy, scheduler, retryListener(job)))
                    .map(result -> JobOutcome.success(result.orElse(null), attempts.get()))
                    .onErrorResume(e -> {
                        log.error("Job {} failed after {} attempts: {}", job.getId(), attempts.get(), e.getMessage(), e);
                        return Mono.just(JobOutcome.failure(e, Math.max(1, attempts.get())));
                    })
                    .map(outcome -> record(job, outcome, timerSample));
        });
    }

    /**
     * Persist the terminal state of a job and wake anyone waiting on it.
     * <p>
     * If the stored job is no longer RUNNING (cancelled, or failed by lease recovery)
     * the outcome is discarded and the stored state is reported instead.
     */
    public JobOutcome record(Job job, JobOutcome outcome, Timer.Sample timerSample) {
        var now = clock.instant();
        var leasedUntil = job.getLeasedUntil();
        job.setAttempts(outcome.getAttempts());
        if (outcome.isSuccess()) {
            job.markSucceeded(outcome.getResult(), now);
        } else {
            job.markFailed(outcome.getErrorType(), outcome.getErrorMessage(), outcome.getErrorStackTrace(), now);
        }

        var recorded = outcome;
        try {
            if (jobStore.finish(job)) {
                log.info("Job {} finished: {}", job.getId(), outcome.status());
            } else {
                recorded = jobStore.findJob(job.getId())
                        .filter(stored -> stored.getStatus().isTerminal())
                        .map(JobOutcome::fromJob)
                        .orElseGet(JobOutcome::cancelled);
                log.info("Job {} was {} while running, discarding its result", job.getId(), recorded.status().getCode());
            }
        } catch (BackendOperationException e) {
            log.error("Could not record result of job {}, it stays leased until {}: {}",
                    job.getId(), leasedUntil, e.getMessage(), e);
        }

        metricsConfig.recordJobExecution(timerSample, job.getFunction(), recorded.status());
        if (recorded.status() == JobStatus.FAILED) {
            metricsConfig.recordJobFailure(job.getFunction(), recorded.getErrorType());
        }
        completionTracker.complete(job.getId(), recorded);
        return recorded;
    }

    private RetryListener retryListener(Job job) {
        return (attempt, delay, error) -> metricsConfig.recordRetry(job.getFunction(), attempt);
    }
}
