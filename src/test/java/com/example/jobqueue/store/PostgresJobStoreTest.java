package com.example.jobqueue.store;

import com.example.jobqueue.backend.BackendConnector;
import com.example.jobqueue.backend.BackendSettings;
import com.example.jobqueue.backend.BackendType;
import com.example.jobqueue.backend.RelationalConnection;
import com.example.jobqueue.config.JobQueueProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the shared store checks against a real PostgreSQL. Skipped without Docker.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("JdbcJobStore on PostgreSQL Tests")
class PostgresJobStoreTest extends AbstractJobStoreTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("jobqueue")
            .withUsername("test")
            .withPassword("test");

    private BackendConnector connector;

    @Override
    protected JobStore createStore() {
        var properties = new JobQueueProperties();
        properties.setType(BackendType.POSTGRESQL.getTag());
        properties.setHost(POSTGRES.getHost());
        properties.setPort(POSTGRES.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT));
        properties.setDatabase("jobqueue");
        properties.setUsername("test");
        properties.setPassword("test");
        properties.setSchema("jq_test");

        connector = new BackendConnector(BackendSettings.from(properties), 4);
        var connection = (RelationalConnection) connector.setup();
        var store = new JdbcJobStore(connection, new JsonCodec());
        store.initialize();
        connection.getJdbcTemplate().execute("TRUNCATE " + connection.qualify("jq_jobs") + ", " + connection.qualify("jq_schedules"));
        return store;
    }

    @AfterEach
    void closeConnector() {
        connector.close();
    }
}
