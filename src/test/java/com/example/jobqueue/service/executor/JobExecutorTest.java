package com.example.jobqueue.service.executor;

import com.example.jobqueue.config.MetricsConfig;
import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.domain.model.RetrySettings;
import com.example.jobqueue.exception.BackendOperationException;
import com.example.jobqueue.exception.UnknownJobFunctionException;
import com.example.jobqueue.retry.BackoffCalculator;
import com.example.jobqueue.retry.RetryExecutor;
import com.example.jobqueue.service.function.JobFunction;
import com.example.jobqueue.service.function.JobFunctionRegistry;
import com.example.jobqueue.store.JobStore;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobExecutor Tests")
class JobExecutorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");

    @Mock
    private JobStore jobStore;

    @Mock
    private JobFunctionRegistry functionRegistry;

    @Mock
    private JobCompletionTracker completionTracker;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private JobFunction function;

    @Mock
    private Timer.Sample timerSample;

    @Captor
    private ArgumentCaptor<Job> jobCaptor;

    private JobExecutor jobExecutor;
    private Job runningJob;

    @BeforeEach
    void setUp() {
        var retryExecutor = new RetryExecutor(new BackoffCalculator(() -> 0.0));
        jobExecutor = new JobExecutor(jobStore, functionRegistry, retryExecutor, completionTracker, metricsConfig,
                Clock.fixed(NOW, ZoneOffset.UTC));

        runningJob = Job.builder()
                .id("job-1")
                .function("resize_image")
                .args(new ArrayList<>(List.of("cat.png")))
                .queue("default")
                .status(JobStatus.RUNNING)
                .workerId("worker-1")
                .startedAt(NOW.minusSeconds(1))
                .leasedUntil(NOW.plusSeconds(600))
                .resultTtl(Duration.ofMinutes(10))
                .retry(new RetrySettings(3, 0.001, 0.0, List.of()))
                .build();
    }

    @Nested
    @DisplayName("execute Tests")
    class ExecuteTests {

        @Test
        @DisplayName("Should record a successful result")
        void shouldRecordSuccess() throws Exception {
            // Given
            when(metricsConfig.startJobExecutionTimer()).thenReturn(timerSample);
            when(functionRegistry.getFunctionOrThrow("resize_image")).thenReturn(function);
            when(function.run(anyList(), anyMap())).thenReturn("thumb.png");
            when(jobStore.finish(any(Job.class))).thenReturn(true);

            // When
            var outcome = jobExecutor.execute(runningJob);

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            verify(jobStore).finish(jobCaptor.capture());
            var finished = jobCaptor.getValue();
            assertThat(finished.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
            assertThat(finished.getResult()).isEqualTo("thumb.png");
            assertThat(finished.getAttempts()).isEqualTo(1);
            assertThat(finished.getFinishedAt()).isEqualTo(NOW);
            assertThat(finished.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
            verify(metricsConfig).recordJobExecution(timerSample, "resize_image", JobStatus.SUCCEEDED);
            verify(completionTracker).complete(eq("job-1"), same(outcome));
        }

        @Test
        @DisplayName("Should fail after max retries plus one attempts")
        void shouldFailAfterRetries() throws Exception {
            // Given
            when(metricsConfig.startJobExecutionTimer()).thenReturn(timerSample);
            when(functionRegistry.getFunctionOrThrow("resize_image")).thenReturn(function);
            when(function.run(anyList(), anyMap())).thenThrow(new IllegalStateException("corrupt image"));
            when(jobStore.finish(any(Job.class))).thenReturn(true);

            // When
            var outcome = jobExecutor.execute(runningJob);

            // Then
            assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
            assertThat(outcome.getAttempts()).isEqualTo(4);
            verify(function, times(4)).run(anyList(), anyMap());
            verify(metricsConfig, times(3)).recordRetry(eq("resize_image"), anyInt());
            verify(metricsConfig).recordJobFailure("resize_image", "java.lang.IllegalStateException");
            verify(jobStore).finish(jobCaptor.capture());
            assertThat(jobCaptor.getValue().getErrorMessage()).isEqualTo("corrupt image");
            assertThat(jobCaptor.getValue().getAttempts()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should succeed on a later attempt")
        void shouldSucceedAfterRetry() throws Exception {
            // Given
            when(metricsConfig.startJobExecutionTimer()).thenReturn(timerSample);
            when(functionRegistry.getFunctionOrThrow("resize_image")).thenReturn(function);
            when(function.run(anyList(), anyMap()))
                    .thenThrow(new IllegalStateException("flaky"))
                    .thenReturn("thumb.png");
            when(jobStore.finish(any(Job.class))).thenReturn(true);

            // When
            var outcome = jobExecutor.execute(runningJob);

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getAttempts()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should fail a job whose function is not registered")
        void shouldFailUnknownFunction() {
            // Given
            when(metricsConfig.startJobExecutionTimer()).thenReturn(timerSample);
            when(functionRegistry.getFunctionOrThrow("resize_image"))
                    .thenThrow(new UnknownJobFunctionException("resize_image"));
            when(jobStore.finish(any(Job.class))).thenReturn(true);

            // When
            var outcome = jobExecutor.execute(runningJob);

            // Then
            assertThat(outcome.getErrorType()).isEqualTo(UnknownJobFunctionException.class.getName());
            assertThat(outcome.getAttempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should report the stored state when the job was cancelled meanwhile")
        void shouldReportCancellation() throws Exception {
            // Given
            var cancelled = runningJob.copy();
            cancelled.markCancelled(NOW);
            when(metricsConfig.startJobExecutionTimer()).thenReturn(timerSample);
            when(functionRegistry.getFunctionOrThrow("resize_image")).thenReturn(function);
            when(function.run(anyList(), anyMap())).thenReturn("thumb.png");
            when(jobStore.finish(any(Job.class))).thenReturn(false);
            when(jobStore.findJob("job-1")).thenReturn(Optional.of(cancelled));

            // When
            var outcome = jobExecutor.execute(runningJob);

            // Then
            assertThat(outcome.status()).isEqualTo(JobStatus.CANCELLED);
            verify(metricsConfig).recordJobExecution(timerSample, "resize_image", JobStatus.CANCELLED);
            verify(completionTracker).complete(eq("job-1"), argThat(JobOutcome::isCancelled));
        }

        @Test
        @DisplayName("Should keep running when the result cannot be stored")
        void shouldSurviveStoreFailure() throws Exception {
            // Given
            when(metricsConfig.startJobExecutionTimer()).thenReturn(timerSample);
            when(functionRegistry.getFunctionOrThrow("resize_image")).thenReturn(function);
            when(function.run(anyList(), anyMap())).thenReturn("thumb.png");
            when(jobStore.finish(any(Job.class))).thenThrow(new BackendOperationException("finish", new RuntimeException("down")));

            // When
            var outcome = jobExecutor.execute(runningJob);

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            verify(completionTracker).complete("job-1", outcome);
        }
    }

    @Nested
    @DisplayName("executeReactive Tests")
    class ExecuteReactiveTests {

        @Test
        @DisplayName("Should retry on the scheduler and record the final failure")
        void shouldRetryReactively() throws Exception {
            // Given
            var scheduler = Schedulers.newSingle("test-fiber");
            when(metricsConfig.startJobExecutionTimer()).thenReturn(timerSample);
            when(functionRegistry.getFunction("resize_image")).thenReturn(Optional.of(function));
            when(function.run(anyList(), anyMap())).thenThrow(new IllegalStateException("corrupt image"));
            when(jobStore.finish(any(Job.class))).thenReturn(true);

            try {
                // When
                var outcome = jobExecutor.executeReactive(runningJob, scheduler).block(Duration.ofSeconds(5));

                // Then
                assertThat(outcome).isNotNull();
                assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
                assertThat(outcome.getAttempts()).isEqualTo(4);
                verify(function, times(4)).run(anyList(), anyMap());
            } finally {
                scheduler.dispose();
            }
        }

        @Test
        @DisplayName("Should record a null result as success")
        void shouldAcceptNullResult() throws Exception {
            // Given
            var scheduler = Schedulers.newSingle("test-fiber");
            when(metricsConfig.startJobExecutionTimer()).thenReturn(timerSample);
            when(functionRegistry.getFunction("resize_image")).thenReturn(Optional.of(function));
            when(function.run(anyList(), anyMap())).thenReturn(null);
            when(jobStore.finish(any(Job.class))).thenReturn(true);

            try {
                // When
                var outcome = jobExecutor.executeReactive(runningJob, scheduler).block(Duration.ofSeconds(5));

                // Then
                assertThat(outcome.isSuccess()).isTrue();
                assertThat(outcome.getResult()).isNull();
            } finally {
                scheduler.dispose();
            }
        }

        @Test
        @DisplayName("Should fail a job whose function is not registered")
        void shouldFailUnknownFunction() {
            // Given
            when(metricsConfig.startJobExecutionTimer()).thenReturn(timerSample);
            when(functionRegistry.getFunction("resize_image")).thenReturn(Optional.empty());
            when(jobStore.finish(any(Job.class))).thenReturn(true);

            // When
            var outcome = jobExecutor.executeReactive(runningJob, Schedulers.immediate()).block();

            // Then
            assertThat(outcome.getErrorType()).isEqualTo(UnknownJobFunctionException.class.getName());
        }
    }

    @Test
    @DisplayName("Should pass the job's arguments to the function")
    void shouldPassArguments() throws Exception {
        // Given
        runningJob.setKwargs(Map.of("width", 64));
        runningJob.setRetry(null);
        when(metricsConfig.startJobExecutionTimer()).thenReturn(timerSample);
        when(functionRegistry.getFunctionOrThrow("resize_image")).thenReturn(function);
        when(jobStore.finish(any(Job.class))).thenReturn(true);

        // When
        jobExecutor.execute(runningJob);

        // Then
        verify(function).run(List.of("cat.png"), Map.of("width", 64));
    }
}
