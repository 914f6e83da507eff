package com.example.jobqueue.backend.event;

import com.example.jobqueue.backend.RelationalConnection;
import com.example.jobqueue.exception.BackendConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Broker riding on the data store's own PostgreSQL pool: publishes with
 * {@code pg_notify} and listens on one dedicated connection.
 * <p>
 * Every node, this one included, receives the notification, so all lease loops
 * wake regardless of where the job was submitted.
 */
@Slf4j
public class PostgresEventBroker implements JobEventBroker {

    static final String CHANNEL = "job_queue_events";

    private static final int LISTEN_TIMEOUT_MS = 500;

    private final JdbcTemplate jdbcTemplate;
    private final Connection listenConnection;
    private final LocalEventBroker local = new LocalEventBroker();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Thread listener;

    private PostgresEventBroker(JdbcTemplate jdbcTemplate, Connection listenConnection) {
        this.jdbcTemplate = jdbcTemplate;
        this.listenConnection = listenConnection;
        this.listener = new Thread(this::listen, "job-queue-pg-listener");
        this.listener.setDaemon(true);
    }

    /**
     * Build a broker on an existing relational connection.
     *
     * @throws BackendConfigurationException if the connection is not a PostgreSQL one,
     *                                       since LISTEN/NOTIFY exists nowhere else
     */
    public static PostgresEventBroker fromDataStore(RelationalConnection connection) {
        if (connection.getJdbcUrl() == null || !connection.getJdbcUrl().startsWith("jdbc:postgresql:")) {
            throw new BackendConfigurationException(connection.getType().getTag(),
                    "event notifications require the PostgreSQL driver, but the data store uses " + connection.getJdbcUrl());
        }
        try {
            var raw = connection.getDataSource().getConnection();
            if (!raw.isWrapperFor(PGConnection.class)) {
                raw.close();
                throw new BackendConfigurationException(connection.getType().getTag(),
                        "event notifications require a PostgreSQL JDBC connection");
            }
            raw.setAutoCommit(true);
            try (var statement = raw.createStatement()) {
                statement.execute("LISTEN " + CHANNEL);
            }
            var broker = new PostgresEventBroker(connection.getJdbcTemplate(), raw);
            broker.listener.start();
            log.info("Listening for job notifications on channel {}", CHANNEL);
            return broker;
        } catch (SQLException e) {
            throw new BackendConfigurationException(connection.getType().getTag(), "could not LISTEN on " + CHANNEL, e);
        }
    }

    @Override
    public void publish(String queue) {
        jdbcTemplate.queryForObject("SELECT pg_notify(?, ?)", Object.class, CHANNEL, queue);
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        return local.await(timeout);
    }

    private void listen() {
        try {
            var pg = listenConnection.unwrap(PGConnection.class);
            while (running.get()) {
                var notifications = pg.getNotifications(LISTEN_TIMEOUT_MS);
                if (notifications != null && notifications.length > 0) {
                    log.debug("Received {} job notifications", notifications.length);
                    local.signal();
                }
            }
        } catch (SQLException e) {
            if (running.get()) {
                log.error("Notification listener stopped: {}", e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        listener.interrupt();
        try {
            listenConnection.close();
        } catch (SQLException e) {
            log.warn("Failed to close listener connection: {}", e.getMessage());
        }
        local.close();
    }
}
