package com.example.jobqueue.backend;

import com.example.jobqueue.exception.BackendConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parsed form of {@code scheme://[user[:pass]@]host[:port][/database][?key=value&...]}.
 * <p>
 * Host may be a comma separated list (MongoDB replica sets), in which case the port
 * stays inside the host string.
 */
@Value
@Builder(toBuilder = true)
public class BackendUri {

    String scheme;
    String username;
    String password;
    String host;
    Integer port;
    String database;

    @Builder.Default
    Map<String, String> params = Map.of();

    public static BackendUri parse(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new BackendConfigurationException("unknown", "connection URI is empty");
        }
        var separator = uri.indexOf("://");
        if (separator <= 0) {
            throw new BackendConfigurationException("unknown", "connection URI has no scheme: " + mask(uri));
        }
        var scheme = uri.substring(0, separator).toLowerCase();
        var rest = uri.substring(separator + 3);

        var params = new LinkedHashMap<String, String>();
        var queryStart = rest.indexOf('?');
        if (queryStart >= 0) {
            for (var pair : rest.substring(queryStart + 1).split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                var eq = pair.indexOf('=');
                var key = eq >= 0 ? pair.substring(0, eq) : pair;
                var value = eq >= 0 ? pair.substring(eq + 1) : "";
                params.put(decode(key), decode(value));
            }
            rest = rest.substring(0, queryStart);
        }

        String database = null;
        var pathStart = rest.indexOf('/');
        if (pathStart >= 0) {
            var path = rest.substring(pathStart + 1);
            database = path.isEmpty() ? null : decode(path);
            rest = rest.substring(0, pathStart);
        }

        String username = null;
        String password = null;
        var at = rest.lastIndexOf('@');
        if (at >= 0) {
            var userInfo = rest.substring(0, at);
            var colon = userInfo.indexOf(':');
            username = colon >= 0 ? userInfo.substring(0, colon) : userInfo;
            password = colon >= 0 ? userInfo.substring(colon + 1) : null;
            username = username.isEmpty() ? null : decode(username);
            password = password == null || password.isEmpty() ? null : decode(password);
            rest = rest.substring(at + 1);
        }

        String host = rest;
        Integer port = null;
        if (!rest.contains(",")) {
            var colon = rest.lastIndexOf(':');
            if (colon >= 0) {
                host = rest.substring(0, colon);
                try {
                    port = Integer.parseInt(rest.substring(colon + 1));
                } catch (NumberFormatException e) {
                    throw new BackendConfigurationException(scheme, "invalid port in URI: " + mask(uri), e);
                }
            }
        }

        return BackendUri.builder()
                .scheme(scheme)
                .username(username)
                .password(password)
                .host(host.isEmpty() ? null : host)
                .port(port)
                .database(database)
                .params(Map.copyOf(params))
                .build();
    }

    public boolean isSslRequested() {
        var ssl = params.getOrDefault("ssl", params.get("tls"));
        return ssl != null && !"false".equalsIgnoreCase(ssl) && !"disable".equalsIgnoreCase(ssl);
    }

    /**
     * Render back to a URI string, credentials percent-encoded.
     */
    public String toUriString() {
        var sb = new StringBuilder(scheme).append("://");
        if (username != null || password != null) {
            if (username != null) {
                sb.append(encode(username));
            }
            if (password != null) {
                sb.append(':').append(encode(password));
            }
            sb.append('@');
        }
        if (host != null) {
            sb.append(host);
        }
        if (port != null) {
            sb.append(':').append(port);
        }
        if (database != null && !database.isEmpty()) {
            sb.append('/').append(encode(database));
        }
        if (!params.isEmpty()) {
            sb.append('?').append(params.entrySet().stream()
                    .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                    .collect(Collectors.joining("&")));
        }
        return sb.toString();
    }

    /**
     * URI with the password replaced, for logging.
     */
    public String toSafeString() {
        return password == null ? toUriString() : toBuilder().password("****").build().toUriString();
    }

    @Override
    public String toString() {
        return toSafeString();
    }

    private static String mask(String uri) {
        return uri.replaceAll("://([^:/@]*):[^@/]*@", "://$1:****@");
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
