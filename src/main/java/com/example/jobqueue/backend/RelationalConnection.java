package com.example.jobqueue.backend;

import com.zaxxer.hikari.HikariDataSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Pooled JDBC connection to PostgreSQL or MySQL.
 */
@Slf4j
@Getter
public class RelationalConnection implements BackendConnection {

    private final BackendType type;
    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final String jdbcUrl;
    private final String schema;

    public RelationalConnection(BackendType type, DataSource dataSource, String jdbcUrl, String schema) {
        this.type = type;
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.jdbcUrl = jdbcUrl;
        this.schema = schema;
    }

    /**
     * Table name qualified with the schema on PostgreSQL; MySQL uses the database itself.
     */
    public String qualify(String table) {
        return type == BackendType.POSTGRESQL ? schema + "." + table : table;
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
            log.info("Closing connection pool for {}", jdbcUrl);
            hikari.close();
        }
    }
}
