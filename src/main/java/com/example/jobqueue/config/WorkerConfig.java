package com.example.jobqueue.config;

import com.example.jobqueue.worker.WorkerSupervisor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Starts a background worker pool with the application when
 * {@code job-queue.worker.enabled} is set.
 */
@Slf4j
@Configuration
public class WorkerConfig {

    @Bean
    @ConditionalOnProperty(prefix = "job-queue.worker", name = "enabled", havingValue = "true")
    public ApplicationRunner workerPoolRunner(WorkerSupervisor supervisor, JobQueueProperties properties) {
        return args -> {
            log.info("Starting {} {} workers with the application", properties.getNumWorkers(),
                    properties.getDefaultJobExecutor());
            supervisor.startWorkerPool(properties.getNumWorkers(), true);
        };
    }
}
