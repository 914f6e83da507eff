package com.example.jobqueue.backend;

import com.example.jobqueue.config.JobQueueProperties;
import com.example.jobqueue.exception.BackendConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Fully resolved connection settings: URI fields merged over discrete fields merged
 * over per-type defaults. Construction validates everything, so a misconfigured
 * backend fails at startup rather than at first use.
 */
@Value
@Builder
public class BackendSettings {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    BackendType type;
    String host;
    Integer port;
    String username;
    String password;
    String database;
    String schema;
    boolean ssl;

    /**
     * Original scheme, kept so mongodb+srv survives
     */
    String scheme;

    @Builder.Default
    Map<String, String> params = Map.of();

    public static BackendSettings from(JobQueueProperties properties) {
        if (properties.getUri() != null && !properties.getUri().isBlank()) {
            var uri = BackendUri.parse(properties.getUri());
            var type = BackendType.fromScheme(uri.getScheme());
            if (properties.getType() != null && !properties.getType().isBlank()
                    && !"memory".equalsIgnoreCase(properties.getType())
                    && BackendType.fromTag(properties.getType()) != type) {
                throw new BackendConfigurationException(properties.getType(),
                        String.format("type '%s' contradicts URI scheme '%s'", properties.getType(), uri.getScheme()));
            }
            return resolve(type, uri.getScheme(),
                    uri.getHost(), uri.getPort(),
                    firstNonBlank(uri.getUsername(), properties.getUsername()),
                    firstNonBlank(uri.getPassword(), properties.getPassword()),
                    firstNonBlank(uri.getDatabase(), properties.getDatabase()),
                    properties.getSchema(),
                    properties.isSsl() || uri.isSslRequested() || type.isSecureScheme(uri.getScheme()),
                    uri.getParams(), true);
        }

        var type = BackendType.fromTag(properties.getType());
        return resolve(type, null, properties.getHost(), properties.getPort(), properties.getUsername(),
                properties.getPassword(), properties.getDatabase(), properties.getSchema(), properties.isSsl(), Map.of(), false);
    }

    private static BackendSettings resolve(BackendType type, String scheme, String host, Integer port, String username,
                                           String password, String database, String schema, boolean ssl,
                                           Map<String, String> params, boolean fromUri) {
        if (!type.isNetwork()) {
            return BackendSettings.builder().type(type).scheme(type.getScheme()).build();
        }

        // A URI must name its host; discrete settings fall back to the default host
        if (fromUri && (host == null || host.isBlank())) {
            throw new BackendConfigurationException(type.getTag(), "connection URI has no host");
        }
        var resolvedHost = firstNonBlank(host, type.getDefaultHost());
        if (resolvedHost == null) {
            throw new BackendConfigurationException(type.getTag(), "host is required");
        }

        var resolvedPort = port != null ? port : type.getDefaultPort();
        if (resolvedPort != null && (resolvedPort < 1 || resolvedPort > 65535)) {
            throw new BackendConfigurationException(type.getTag(), "port out of range: " + resolvedPort);
        }

        var resolvedDatabase = firstNonBlank(database, type.getDefaultDatabase());
        if (type.isRelational()) {
            requireIdentifier(type, "database", resolvedDatabase);
            if (type == BackendType.POSTGRESQL) {
                requireIdentifier(type, "schema", schema);
            }
        }
        if (type == BackendType.REDIS) {
            try {
                Integer.parseInt(resolvedDatabase);
            } catch (NumberFormatException e) {
                throw new BackendConfigurationException(type.getTag(), "redis database must be a number: " + resolvedDatabase, e);
            }
        }

        return BackendSettings.builder()
                .type(type)
                .scheme(scheme != null ? scheme : type.schemeFor(ssl))
                .host(resolvedHost)
                .port(resolvedPort)
                .username(firstNonBlank(username, type.getDefaultUsername()))
                .password(password)
                .database(resolvedDatabase)
                .schema(type == BackendType.MYSQL ? resolvedDatabase : schema)
                .ssl(ssl)
                .params(params == null ? Map.of() : Map.copyOf(params))
                .build();
    }

    /**
     * URI generated from the resolved fields, TLS expressed as the secure scheme or an ssl flag.
     */
    public BackendUri toUri() {
        if (!type.isNetwork()) {
            return BackendUri.builder().scheme(type.getScheme()).build();
        }
        var query = new LinkedHashMap<>(params);
        if (ssl && !type.isSecureScheme(scheme)) {
            query.putIfAbsent(type == BackendType.MONGODB ? "tls" : "ssl", "true");
        }
        return BackendUri.builder()
                .scheme(scheme)
                .username(username)
                .password(password)
                .host(host)
                .port(type.isSecureScheme(scheme) && type == BackendType.MONGODB ? null : port)
                .database(database)
                .params(query)
                .build();
    }

    /**
     * JDBC URL of the target database.
     */
    public String jdbcUrl() {
        return jdbcUrl(database);
    }

    /**
     * JDBC URL of another database on the same server, used to bootstrap the target.
     */
    public String jdbcUrl(String databaseName) {
        switch (type) {
            case POSTGRESQL:
                return String.format("jdbc:postgresql://%s:%d/%s%s", host, port, databaseName, ssl ? "?sslmode=require" : "");
            case MYSQL:
                return String.format("jdbc:mysql://%s:%d/%s%s", host, port, databaseName, ssl ? "?sslMode=REQUIRED" : "");
            default:
                throw new BackendConfigurationException(type.getTag(), "not a relational backend");
        }
    }

    /**
     * Database the bootstrap connection uses while the target may not exist yet.
     */
    public String systemDatabase() {
        return type == BackendType.POSTGRESQL ? "postgres" : "mysql";
    }

    @Override
    public String toString() {
        return type.getTag() + " " + toUri().toSafeString();
    }

    private static void requireIdentifier(BackendType type, String field, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new BackendConfigurationException(type.getTag(),
                    String.format("%s '%s' must be a plain identifier (letters, digits, underscore)", field, value));
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
