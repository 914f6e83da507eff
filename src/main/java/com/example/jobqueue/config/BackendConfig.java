package com.example.jobqueue.config;

import com.example.jobqueue.backend.BackendConnector;
import com.example.jobqueue.backend.BackendSettings;
import com.example.jobqueue.backend.BackendType;
import com.example.jobqueue.backend.BrokerConnection;
import com.example.jobqueue.backend.DocumentConnection;
import com.example.jobqueue.backend.RelationalConnection;
import com.example.jobqueue.backend.event.JobEventBroker;
import com.example.jobqueue.backend.event.LocalEventBroker;
import com.example.jobqueue.backend.event.PostgresEventBroker;
import com.example.jobqueue.retry.BackoffCalculator;
import com.example.jobqueue.retry.RetryExecutor;
import com.example.jobqueue.store.JdbcJobStore;
import com.example.jobqueue.store.JobStore;
import com.example.jobqueue.store.JsonCodec;
import com.example.jobqueue.store.MemoryJobStore;
import com.example.jobqueue.store.MongoJobStore;
import com.example.jobqueue.store.RedisJobStore;
import com.example.jobqueue.trigger.TriggerResolver;
import com.example.jobqueue.worker.process.JvmWorkerProcessLauncher;
import com.example.jobqueue.worker.process.WorkerProcessLauncher;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.DefaultLockingTaskExecutor;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import net.javacrumbs.shedlock.provider.inmemory.InMemoryLockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.provider.mongo.MongoLockProvider;
import net.javacrumbs.shedlock.provider.redis.spring.RedisLockProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the configured backend: connection, job store, enqueue notifications and
 * the ShedLock provider for the dispatch and maintenance ticks.
 * <p>
 * The backend is chosen at startup from {@code job-queue.type} or the scheme of
 * {@code job-queue.uri}; an invalid configuration fails the context.
 */
@Slf4j
@Configuration
public class BackendConfig {

    private static final String LOCK_ENVIRONMENT = "job-queue";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JsonCodec jsonCodec() {
        return new JsonCodec();
    }

    @Bean
    public BackendSettings backendSettings(JobQueueProperties properties) {
        var settings = BackendSettings.from(properties);
        log.info("Using {} backend: {}", settings.getType().getTag(), settings);
        return settings;
    }

    @Bean(destroyMethod = "close")
    public BackendConnector backendConnector(BackendSettings settings, JobQueueProperties properties) {
        // Lease loop, maintenance ticks and API callers share the pool with the job slots
        return new BackendConnector(settings, properties.getMaxConcurrentJobs() + 4);
    }

    @Bean
    public JobStore jobStore(BackendConnector connector, JsonCodec jsonCodec) {
        var connection = connector.setup();
        JobStore store = switch (connector.getType()) {
            case MEMORY -> new MemoryJobStore();
            case POSTGRESQL, MYSQL -> new JdbcJobStore((RelationalConnection) connection, jsonCodec);
            case MONGODB -> new MongoJobStore((DocumentConnection) connection, jsonCodec);
            case REDIS -> new RedisJobStore((BrokerConnection) connection, jsonCodec);
        };
        store.initialize();
        return store;
    }

    @Bean(destroyMethod = "close")
    public JobEventBroker jobEventBroker(BackendConnector connector) {
        if (connector.getType() == BackendType.POSTGRESQL) {
            return PostgresEventBroker.fromDataStore((RelationalConnection) connector.client());
        }
        return new LocalEventBroker();
    }

    /**
     * Lock provider on the same backend as the jobs, so every node sharing the
     * backend sees the same locks.
     */
    @Bean
    public LockProvider lockProvider(BackendConnector connector) {
        var connection = connector.client();
        return switch (connector.getType()) {
            case MEMORY -> new InMemoryLockProvider();
            case POSTGRESQL, MYSQL -> {
                var relational = (RelationalConnection) connection;
                yield new JdbcTemplateLockProvider(
                        JdbcTemplateLockProvider.Configuration.builder()
                                .withJdbcTemplate(relational.getJdbcTemplate())
                                .withTableName(relational.qualify("shedlock"))
                                .usingDbTime()
                                .build()
                );
            }
            case MONGODB -> {
                var document = (DocumentConnection) connection;
                yield new MongoLockProvider(document.getClient().getDatabase(document.getDatabase()));
            }
            case REDIS -> new RedisLockProvider(((BrokerConnection) connection).getConnectionFactory(), LOCK_ENVIRONMENT);
        };
    }

    @Bean
    public LockingTaskExecutor lockingTaskExecutor(LockProvider lockProvider) {
        return new DefaultLockingTaskExecutor(lockProvider);
    }

    @Bean
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator();
    }

    @Bean
    public RetryExecutor retryExecutor(BackoffCalculator backoffCalculator) {
        return new RetryExecutor(backoffCalculator);
    }

    @Bean
    public TriggerResolver triggerResolver(Clock clock) {
        return new TriggerResolver(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerProcessLauncher workerProcessLauncher() {
        return new JvmWorkerProcessLauncher();
    }
}
