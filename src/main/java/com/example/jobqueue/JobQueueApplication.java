package com.example.jobqueue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Job Queue Service Application
 * <p>
 * Runs functions as jobs on a pluggable backend and fires them from cron,
 * interval or date schedules.
 * <p>
 * Features:
 * - Memory, PostgreSQL, MySQL, MongoDB and Redis backends chosen by configuration
 * - Thread, process and fiber worker pools
 * - Exponential backoff retries with jitter
 * - Schedules with pause, resume and missed-firing coalescing
 * - Distributed schedule dispatch guarded by ShedLock
 * <p>
 * Backend clients are built by {@link com.example.jobqueue.backend.BackendConnector}
 * from {@code job-queue.*} properties, so Boot's own data source and client
 * auto-configuration is switched off.
 */
@SpringBootApplication(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class,
        RedisAutoConfiguration.class,
        RedisRepositoriesAutoConfiguration.class
})
public class JobQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobQueueApplication.class, args);
    }
}
