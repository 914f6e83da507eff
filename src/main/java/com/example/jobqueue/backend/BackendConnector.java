package com.example.jobqueue.backend;

import com.example.jobqueue.exception.BackendConfigurationException;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClients;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

/**
 * Creates the one {@link BackendConnection} for the configured backend.
 * <p>
 * The kind is resolved once, at construction. {@link #setup()} connects (and for
 * relational kinds bootstraps database and schema); {@link #client()} does the same
 * lazily and memoizes the result.
 */
@Slf4j
public class BackendConnector implements AutoCloseable {

    @Getter
    private final BackendSettings settings;

    private final int poolSize;

    private volatile BackendConnection connection;

    public BackendConnector(BackendSettings settings, int poolSize) {
        this.settings = settings;
        this.poolSize = poolSize;
    }

    public BackendType getType() {
        return settings.getType();
    }

    /**
     * Connect now, replacing nothing if already connected.
     */
    public synchronized BackendConnection setup() {
        if (connection == null) {
            log.info("Connecting to {} backend at {}", settings.getType().getTag(), settings.toUri().toSafeString());
            connection = connect();
        }
        return connection;
    }

    public BackendConnection client() {
        var current = connection;
        return current != null ? current : setup();
    }

    private BackendConnection connect() {
        return switch (settings.getType()) {
            case MEMORY -> new MemoryConnection();
            case POSTGRESQL, MYSQL -> connectRelational();
            case MONGODB -> connectDocument();
            case REDIS -> connectBroker();
        };
    }

    private RelationalConnection connectRelational() {
        new RelationalBootstrap(settings).ensureDatabaseAndSchema();

        var config = new HikariConfig();
        config.setPoolName("job-queue-" + settings.getType().getTag());
        config.setJdbcUrl(settings.jdbcUrl());
        config.setUsername(settings.getUsername());
        config.setPassword(settings.getPassword());
        config.setMaximumPoolSize(poolSize);
        if (settings.getType() == BackendType.POSTGRESQL) {
            config.setSchema(settings.getSchema());
        }
        return new RelationalConnection(settings.getType(), new HikariDataSource(config), settings.jdbcUrl(), settings.getSchema());
    }

    private DocumentConnection connectDocument() {
        try {
            var connectionString = new ConnectionString(settings.toUri().toUriString());
            var clientSettings = MongoClientSettings.builder()
                    .applyConnectionString(connectionString)
                    .applicationName("job-queue")
                    .build();
            return new DocumentConnection(MongoClients.create(clientSettings), settings.getDatabase());
        } catch (IllegalArgumentException e) {
            throw new BackendConfigurationException(settings.getType().getTag(), e.getMessage(), e);
        }
    }

    private BrokerConnection connectBroker() {
        var standalone = new RedisStandaloneConfiguration(settings.getHost(), settings.getPort());
        standalone.setDatabase(Integer.parseInt(settings.getDatabase()));
        if (settings.getUsername() != null) {
            standalone.setUsername(settings.getUsername());
        }
        if (settings.getPassword() != null) {
            standalone.setPassword(settings.getPassword());
        }

        var clientConfig = LettuceClientConfiguration.builder();
        if (settings.isSsl()) {
            clientConfig.useSsl();
        }

        var factory = new LettuceConnectionFactory(standalone, clientConfig.build());
        factory.afterPropertiesSet();
        return new BrokerConnection(factory);
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            connection.close();
            connection = null;
        }
    }
}
