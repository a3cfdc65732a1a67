package com.example.querygate.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of the configured database connections for a single request.
 */
public record ConnectionSettings(String defaultConnection, Map<String, Connection> connections) {

    public ConnectionSettings {
        connections = Collections.unmodifiableMap(new LinkedHashMap<>(connections));
    }

    public record Connection(String name, String url, String username, String password, String prefix) {
        public Connection {
            prefix = prefix == null ? "" : prefix;
        }
    }

    public Optional<Connection> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(connections.get(name));
    }

    /**
     * Table prefix of the named connection; empty when the connection is unknown or has none.
     */
    public String prefixFor(String name) {
        return find(name).map(Connection::prefix).orElse("");
    }

    public String resolveConnectionName(String requested) {
        if (requested == null || requested.isBlank()) {
            return defaultConnection;
        }
        return requested;
    }
}
