package com.example.jobqueue.config;

import com.example.jobqueue.domain.enums.JobStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics configuration for monitoring job queue health and performance.
 * <p>
 * Exposes Micrometer metrics for:
 * - Submitted, finished and cancelled jobs
 * - Execution times by function
 * - Retries and failures
 * - Schedule firings
 * - Busy worker slots
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    private final AtomicInteger busySlots = new AtomicInteger();

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("job_queue_busy_slots", busySlots, AtomicInteger::get)
                .description("Worker slots currently executing a job")
                .register(meterRegistry);
    }

    /**
     * Create a timer for job execution
     */
    public Timer.Sample startJobExecutionTimer() {
        busySlots.incrementAndGet();
        return Timer.start(meterRegistry);
    }

    /**
     * Record job execution time and outcome
     */
    public void recordJobExecution(Timer.Sample sample, String function, JobStatus status) {
        busySlots.decrementAndGet();
        sample.stop(Timer.builder("job_queue_execution_time")
                .tag("function", function)
                .tag("status", status.getCode())
                .description("Job execution time")
                .register(meterRegistry));
    }

    public void recordJobSubmitted(String queue) {
        meterRegistry.counter("job_queue_submitted", "queue", queue).increment();
    }

    public void recordJobCancelled(String queue) {
        meterRegistry.counter("job_queue_cancelled", "queue", queue != null ? queue : "unknown").increment();
    }

    /**
     * Record job failure
     */
    public void recordJobFailure(String function, String errorType) {
        meterRegistry.counter("job_queue_failures",
                "function", function,
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    /**
     * Record retry
     */
    public void recordRetry(String function, int attemptNumber) {
        meterRegistry.counter("job_queue_retries",
                "function", function,
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordScheduleFired(String function) {
        meterRegistry.counter("job_queue_schedule_firings", "function", function).increment();
    }

    public void recordLeaseExpired() {
        meterRegistry.counter("job_queue_lease_expired").increment();
    }
}
