package com.example.jobqueue.worker;

import com.example.jobqueue.domain.enums.ExecutorKind;
import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.service.JobSubmission;
import com.example.jobqueue.service.schedule.ScheduleRequest;
import com.example.jobqueue.store.JsonCodec;
import com.example.jobqueue.support.Eventually;
import com.example.jobqueue.support.JobQueueFixture;
import com.example.jobqueue.trigger.TriggerSpec;
import com.example.jobqueue.worker.process.WorkerProcessLauncher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WorkerSupervisor Tests")
class WorkerSupervisorTest {

    private JobQueueFixture fixture;
    private WorkerSupervisor supervisor;

    @BeforeEach
    void setUp() {
        fixture = new JobQueueFixture();
        fixture.properties.setPollTimeout(Duration.ofMillis(50));
        fixture.properties.setSchedulerInterval(Duration.ofMillis(50));
        fixture.properties.setShutdownGracePeriod(Duration.ofSeconds(2));
        fixture.properties.setMaxConcurrentJobs(3);

        WorkerProcessLauncher launcher = slot -> {
            throw new IOException("process workers are not used here");
        };
        var factory = new ExecutionEngineFactory(fixture.store, fixture.broker, fixture.jobExecutor,
                fixture.functions, launcher, new JsonCodec(), fixture.metrics, fixture.properties, fixture.clock);
        supervisor = new WorkerSupervisor(factory, fixture.dispatcher, fixture.maintenance, fixture.properties,
                "test-host");
    }

    @AfterEach
    void tearDown() {
        supervisor.destroy();
    }

    private void awaitStatus(String jobId, JobStatus status) throws InterruptedException {
        Eventually.await("job " + jobId + " is " + status, Duration.ofSeconds(5),
                () -> fixture.store.findJob(jobId).map(Job::getStatus).orElse(null) == status);
    }

    @Nested
    @DisplayName("Execution Tests")
    class ExecutionTests {

        @ParameterizedTest
        @EnumSource(value = ExecutorKind.class, names = {"THREAD", "FIBER"})
        @DisplayName("Should run queued jobs to completion")
        void shouldRunQueuedJobs(ExecutorKind kind) throws Exception {
            // Given
            var ids = new ArrayList<String>();
            for (var i = 0; i < 5; i++) {
                ids.add(fixture.jobQueueService.addJob(JobSubmission.of("echo", i)));
            }

            // When
            supervisor.startWorkerPool(2, kind, true, false);

            // Then
            for (var id : ids) {
                awaitStatus(id, JobStatus.SUCCEEDED);
            }
            assertThat(supervisor.currentPool().orElseThrow().getEngine().getKind()).isEqualTo(kind);
        }

        @ParameterizedTest
        @EnumSource(value = ExecutorKind.class, names = {"THREAD", "FIBER"})
        @DisplayName("Should pick up jobs submitted after start")
        void shouldPickUpLateJobs(ExecutorKind kind) throws Exception {
            // Given
            supervisor.startWorkerPool(1, kind, true, false);

            // When
            var id = fixture.jobQueueService.addJob(JobSubmission.of("echo", "late"));

            // Then
            awaitStatus(id, JobStatus.SUCCEEDED);
        }

        @Test
        @DisplayName("Should dispatch due schedules when running with scheduler")
        void shouldDispatchSchedules() throws Exception {
            // Given
            var scheduleId = fixture.scheduleService.addSchedule(ScheduleRequest.builder()
                    .function("echo")
                    .trigger(TriggerSpec.interval(Duration.ofMinutes(1)))
                    .build());

            // When
            supervisor.startWorkerPool(1, ExecutorKind.THREAD, true, true);

            // Then
            Eventually.await("schedule job succeeded", Duration.ofSeconds(5),
                    () -> fixture.store.findJobs(null).stream()
                            .anyMatch(job -> scheduleId.equals(job.getScheduleId())
                                    && job.getStatus() == JobStatus.SUCCEEDED));
        }
    }

    @Nested
    @DisplayName("Lifecycle Tests")
    class LifecycleTests {

        @Test
        @DisplayName("Should cap slots at max concurrent jobs")
        void shouldCapSlots() throws Exception {
            // When
            supervisor.startWorkerPool(10, ExecutorKind.THREAD, true, false);

            // Then
            assertThat(supervisor.currentPool().orElseThrow().getEngine().getSlots()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should keep the running pool on a second start")
        void shouldIgnoreSecondStart() throws Exception {
            // Given
            supervisor.startWorkerPool(1, ExecutorKind.THREAD, true, false);
            var first = supervisor.currentPool().orElseThrow();

            // When
            supervisor.startWorkerPool(2, ExecutorKind.FIBER, true, false);

            // Then
            assertThat(supervisor.currentPool()).containsSame(first);
        }

        @Test
        @DisplayName("Should reject fewer than one worker")
        void shouldRejectZeroWorkers() {
            assertThatThrownBy(() -> supervisor.startWorkerPool(0, ExecutorKind.THREAD, true, false))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(supervisor.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Should stop the pool and allow a restart")
        void shouldStopAndRestart() throws Exception {
            // Given
            supervisor.startWorkerPool(1, ExecutorKind.THREAD, true, false);
            var first = supervisor.currentPool().orElseThrow();

            // When
            supervisor.stopWorkerPool();

            // Then
            assertThat(supervisor.isRunning()).isFalse();
            assertThat(first.isRunning()).isFalse();

            supervisor.startWorker(true);
            assertThat(supervisor.isRunning()).isTrue();
            assertThat(supervisor.currentPool().orElseThrow().getWorkerId()).isNotEqualTo(first.getWorkerId());
        }

        @Test
        @DisplayName("Should return from a blocking start once stopped")
        void shouldUnblockForegroundStart() throws Exception {
            // Given
            var failure = new AtomicReference<Throwable>();
            var runner = new Thread(() -> {
                try {
                    supervisor.startWorkerPool(1, ExecutorKind.THREAD, false, false);
                } catch (Throwable e) {
                    failure.set(e);
                }
            });
            runner.start();
            Eventually.await("pool started", Duration.ofSeconds(5), supervisor::isRunning);

            // When
            supervisor.stopWorkerPool();
            runner.join(5000);

            // Then
            assertThat(runner.isAlive()).isFalse();
            assertThat(failure.get()).isNull();
        }

        @Test
        @DisplayName("Should tolerate stop without a running pool")
        void shouldTolerateStopWhenIdle() {
            supervisor.stopWorkerPool();
            assertThat(supervisor.isRunning()).isFalse();
        }
    }
}
