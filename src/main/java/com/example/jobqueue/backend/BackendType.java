package com.example.jobqueue.backend;

import com.example.jobqueue.exception.BackendConfigurationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Backend kinds with the defaults used to fill in missing connection fields.
 */
@Getter
@RequiredArgsConstructor
public enum BackendType {

    MEMORY("memory", "memory", null, null, null, null, null),
    POSTGRESQL("postgresql", "postgresql", null, "localhost", 5432, "postgres", "postgres"),
    MYSQL("mysql", "mysql", null, "localhost", 3306, "mysql", "root"),
    MONGODB("mongodb", "mongodb", "mongodb+srv", "localhost", 27017, "admin", null),
    REDIS("redis", "redis", "rediss", "localhost", 6379, "0", null);

    private final String tag;
    private final String scheme;

    /**
     * Scheme variant that implies TLS, if the kind has one
     */
    private final String secureScheme;

    private final String defaultHost;
    private final Integer defaultPort;
    private final String defaultDatabase;
    private final String defaultUsername;

    /**
     * Resolve a configured type tag.
     *
     * @throws BackendConfigurationException listing the valid tags when the tag is unknown
     */
    public static BackendType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new BackendConfigurationException("unknown", "a backend type is required, valid types: " + validTags());
        }
        var normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (var type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        throw new BackendConfigurationException(tag, String.format("unsupported backend type '%s', valid types: %s", tag, validTags()));
    }

    /**
     * Resolve the kind a connection URI scheme selects.
     */
    public static BackendType fromScheme(String scheme) {
        var normalized = scheme == null ? "" : scheme.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "memory":
                return MEMORY;
            case "postgres":
            case "postgresql":
                return POSTGRESQL;
            case "mysql":
                return MYSQL;
            case "mongodb":
            case "mongodb+srv":
                return MONGODB;
            case "redis":
            case "rediss":
                return REDIS;
            default:
                throw new BackendConfigurationException(scheme, String.format("unsupported URI scheme '%s', valid types: %s", scheme, validTags()));
        }
    }

    public static String validTags() {
        return Arrays.stream(values()).map(BackendType::getTag).collect(Collectors.joining(", "));
    }

    public boolean isRelational() {
        return this == POSTGRESQL || this == MYSQL;
    }

    public boolean isNetwork() {
        return this != MEMORY;
    }

    public boolean isSecureScheme(String scheme) {
        return secureScheme != null && secureScheme.equalsIgnoreCase(scheme);
    }

    /**
     * Scheme for generated URIs, switching to the secure variant for Redis when TLS is on.
     */
    public String schemeFor(boolean ssl) {
        return ssl && this == REDIS ? secureScheme : scheme;
    }
}
