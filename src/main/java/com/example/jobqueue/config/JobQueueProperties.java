package com.example.jobqueue.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the job queue.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-queue")
public class JobQueueProperties {

    /**
     * Backend type tag: memory, postgresql, mysql, mongodb or redis.
     * Ignored when a URI is given, whose scheme decides.
     */
    private String type = "memory";

    /**
     * Full connection URI, takes precedence over the discrete fields
     */
    private String uri;

    private String username;

    private String password;

    private String host;

    private Integer port;

    private String database;

    /**
     * Relational schema (PostgreSQL) the tables live in
     */
    @NotBlank
    private String schema = "job_queue";

    private boolean ssl = false;

    /**
     * Queue names serviced by workers; the first one is the default queue
     */
    @NotEmpty
    private List<String> queues = new ArrayList<>(List.of("default"));

    /**
     * Worker slots started by the supervisor
     */
    @Min(1)
    private int numWorkers = 4;

    /**
     * Interval of the result purge and stale lease sweep
     */
    @NotNull
    private Duration cleanupInterval = Duration.ofSeconds(60);

    /**
     * Upper bound of jobs executing at once in one pool
     */
    @Min(1)
    private int maxConcurrentJobs = 10;

    /**
     * Default worker kind: thread, process or fiber
     */
    @NotBlank
    private String defaultJobExecutor = "thread";

    /**
     * Bounded wait of one lease attempt
     */
    @NotNull
    private Duration pollTimeout = Duration.ofSeconds(1);

    /**
     * Interval of the schedule dispatch tick
     */
    @NotNull
    private Duration schedulerInterval = Duration.ofSeconds(1);

    /**
     * How long a leased job may run before the lease is considered stale
     */
    @NotNull
    private Duration leaseDuration = Duration.ofMinutes(30);

    /**
     * Time in-flight jobs get to finish on shutdown before slots are terminated
     */
    @NotNull
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    /**
     * Store polling interval while waiting on a job result
     */
    @NotNull
    private Duration resultPollInterval = Duration.ofMillis(100);

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Worker worker = new Worker();

    @Data
    public static class Retry {

        @Min(0)
        private int maxRetries = 0;

        /**
         * Base delay in seconds
         */
        @DecimalMin("0.0")
        private double retryDelay = 1.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.1;
    }

    @Data
    public static class Worker {

        /**
         * Start a background worker pool with the application
         */
        private boolean enabled = false;

        /**
         * Let the started pool dispatch schedules as well
         */
        private boolean withScheduler = true;
    }

    public String getDefaultQueue() {
        return queues.get(0);
    }
}
