package com.example.jobqueue.worker.process;

import com.example.jobqueue.domain.enums.ExecutorKind;
import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.exception.WorkerProcessException;
import com.example.jobqueue.service.JobSubmission;
import com.example.jobqueue.store.JsonCodec;
import com.example.jobqueue.support.DirectWorkerProcess;
import com.example.jobqueue.support.Eventually;
import com.example.jobqueue.support.JobQueueFixture;
import com.example.jobqueue.worker.JobLeaser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProcessExecutionEngine Tests")
class ProcessExecutionEngineTest {

    private static final String CRASH = "crash-me";

    private JobQueueFixture fixture;
    private ProcessExecutionEngine engine;
    private final AtomicInteger launches = new AtomicInteger();
    private final List<DirectWorkerProcess> processes = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        fixture = new JobQueueFixture(new WorkerProcessHandlerTest.FailingFunction());
        var codec = new JsonCodec();
        var handler = new WorkerProcessHandler(codec, fixture.retryExecutor);
        var leaser = new JobLeaser(fixture.store, fixture.broker, fixture.properties.getQueues(),
                Duration.ofMinutes(5), Duration.ofMillis(50), "w-test", fixture.clock);

        WorkerProcessLauncher launcher = slot -> {
            launches.incrementAndGet();
            var process = new DirectWorkerProcess(line -> line.contains(CRASH) ? null : codec.write(handler.handle(line)));
            processes.add(process);
            return process;
        };
        engine = new ProcessExecutionEngine(leaser, fixture.jobExecutor, fixture.functions, launcher, codec,
                fixture.metrics, 1);
    }

    @AfterEach
    void tearDown() {
        engine.stop(Duration.ofSeconds(1));
    }

    private Job awaitFinished(String jobId) throws InterruptedException {
        Eventually.await("job " + jobId + " finishes", Duration.ofSeconds(5),
                () -> fixture.store.findJob(jobId).map(job -> job.getStatus().isTerminal()).orElse(false));
        return fixture.store.findJob(jobId).orElseThrow();
    }

    @Test
    @DisplayName("Should report kind and slots")
    void shouldReportKindAndSlots() {
        assertThat(engine.getKind()).isEqualTo(ExecutorKind.PROCESS);
        assertThat(engine.getSlots()).isEqualTo(1);
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should run job in child and record its result")
    void shouldRunJobInChild() throws Exception {
        // Given
        engine.start();

        // When
        var jobId = fixture.jobQueueService.addJob(JobSubmission.of("echo", "x"));

        // Then
        var job = awaitFinished(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.getResult()).isInstanceOf(Map.class);
        assertThat(job.getAttempts()).isEqualTo(1);
        assertThat(launches.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should record failure reported by child")
    void shouldRecordChildFailure() throws Exception {
        // Given
        engine.start();

        // When
        var jobId = fixture.jobQueueService.addJob(JobSubmission.of(WorkerProcessHandlerTest.FailingFunction.NAME));

        // Then
        var job = awaitFinished(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorType()).isEqualTo(IllegalStateException.class.getName());
        assertThat(job.getErrorMessage()).isEqualTo(WorkerProcessHandlerTest.FailingFunction.MESSAGE);
    }

    @Test
    @DisplayName("Should fail job of crashed child and replace the child")
    void shouldReplaceCrashedChild() throws Exception {
        // Given
        engine.start();

        // When
        var crashed = fixture.jobQueueService.addJob(JobSubmission.of("echo", CRASH));
        var crashedJob = awaitFinished(crashed);
        var next = fixture.jobQueueService.addJob(JobSubmission.of("echo", "after"));
        var nextJob = awaitFinished(next);

        // Then
        assertThat(crashedJob.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(crashedJob.getErrorType()).isEqualTo(WorkerProcessException.class.getName());
        assertThat(nextJob.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(launches.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should shut down idle children on stop")
    void shouldShutDownChildrenOnStop() throws Exception {
        // Given
        engine.start();
        Eventually.await("child launched", Duration.ofSeconds(5), () -> !processes.isEmpty());

        // When
        engine.stop(Duration.ofSeconds(1));

        // Then
        assertThat(engine.isRunning()).isFalse();
        assertThat(processes.get(0).wasShutDown()).isTrue();
    }
}
