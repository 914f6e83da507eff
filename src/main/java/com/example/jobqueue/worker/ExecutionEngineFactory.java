package com.example.jobqueue.worker;

import com.example.jobqueue.backend.event.JobEventBroker;
import com.example.jobqueue.config.JobQueueProperties;
import com.example.jobqueue.config.MetricsConfig;
import com.example.jobqueue.domain.enums.ExecutorKind;
import com.example.jobqueue.service.executor.JobExecutor;
import com.example.jobqueue.service.function.JobFunctionRegistry;
import com.example.jobqueue.store.JobStore;
import com.example.jobqueue.store.JsonCodec;
import com.example.jobqueue.worker.process.ProcessExecutionEngine;
import com.example.jobqueue.worker.process.WorkerProcessLauncher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds execution engines of each kind from the shared services.
 */
@Component
@RequiredArgsConstructor
public class ExecutionEngineFactory {

    private final JobStore jobStore;
    private final JobEventBroker eventBroker;
    private final JobExecutor jobExecutor;
    private final JobFunctionRegistry functionRegistry;
    private final WorkerProcessLauncher processLauncher;
    private final JsonCodec jsonCodec;
    private final MetricsConfig metricsConfig;
    private final JobQueueProperties properties;
    private final Clock clock;

    public ExecutionEngine create(ExecutorKind kind, int slots, String workerId) {
        var leaser = new JobLeaser(jobStore, eventBroker, properties.getQueues(), properties.getLeaseDuration(),
                properties.getPollTimeout(), workerId, clock);
        return switch (kind) {
            case THREAD -> new ThreadExecutionEngine(leaser, jobExecutor, slots);
            case FIBER -> new FiberExecutionEngine(leaser, jobExecutor, slots);
            case PROCESS -> new ProcessExecutionEngine(leaser, jobExecutor, functionRegistry, processLauncher,
                    jsonCodec, metricsConfig, slots);
        };
    }
}
