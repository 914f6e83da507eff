package com.example.jobqueue.backend;

import com.example.jobqueue.exception.BackendConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Makes sure the target database and schema exist before the pool connects.
 * <p>
 * The target may not exist yet, so the database check runs over a short-lived
 * connection to the server's system database. PostgreSQL cannot create a database
 * inside a transaction; schema creation does run in one.
 */
@Slf4j
@RequiredArgsConstructor
public class RelationalBootstrap {

    private final BackendSettings settings;

    public void ensureDatabaseAndSchema() {
        try {
            ensureDatabase();
            ensureSchema();
        } catch (DataAccessException e) {
            throw new BackendConfigurationException(settings.getType().getTag(),
                    "could not prepare database " + settings.getDatabase() + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    void ensureDatabase() {
        var jdbc = new JdbcTemplate(dataSource(settings.jdbcUrl(settings.systemDatabase())));
        var database = settings.getDatabase();

        if (settings.getType() == BackendType.POSTGRESQL) {
            var exists = jdbc.queryForObject("SELECT COUNT(*) FROM pg_database WHERE datname = ?", Integer.class, database);
            if (exists == null || exists == 0) {
                log.info("Creating database {}", database);
                jdbc.execute("CREATE DATABASE \"" + database + "\"");
            }
        } else {
            log.debug("Ensuring database {} exists", database);
            jdbc.execute("CREATE DATABASE IF NOT EXISTS `" + database + "`");
        }
    }

    void ensureSchema() {
        if (settings.getType() != BackendType.POSTGRESQL) {
            // MySQL schemas are databases
            return;
        }
        var target = dataSource(settings.jdbcUrl());
        var jdbc = new JdbcTemplate(target);
        var tx = new TransactionTemplate(new DataSourceTransactionManager(target));
        tx.executeWithoutResult(status -> {
            log.debug("Ensuring schema {} exists in {}", settings.getSchema(), settings.getDatabase());
            jdbc.execute("CREATE SCHEMA IF NOT EXISTS \"" + settings.getSchema() + "\"");
        });
    }

    private DataSource dataSource(String url) {
        return new DriverManagerDataSource(url, settings.getUsername(), settings.getPassword());
    }
}
