package com.example.querygate.db;

import com.example.querygate.config.ConnectionSettings;
import com.example.querygate.config.ConnectionSettingsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Executes statements through plain JDBC, opening one connection per call.
 * Each call runs in a read-only transaction that is always rolled back.
 */
public class JdbcQueryExecutor implements QueryExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final ConnectionSettingsProvider settingsProvider;

    public JdbcQueryExecutor(ConnectionSettingsProvider settingsProvider) {
        this.settingsProvider = settingsProvider;
    }

    @Override
    public List<Map<String, Object>> select(String connectionName, String sql) throws SQLException {
        ConnectionSettings.Connection definition = settingsProvider.current().find(connectionName)
                .orElseThrow(() -> new SQLException("Database connection [" + connectionName + "] not configured."));
        if (definition.url() == null || definition.url().isBlank()) {
            throw new SQLException("No JDBC url configured for database connection [" + connectionName + "].");
        }

        long started = System.nanoTime();
        try (Connection connection = DriverManager.getConnection(definition.url(), definition.username(), definition.password());
             Statement statement = connection.createStatement()) {
            connection.setReadOnly(true);
            connection.setAutoCommit(false);
            try {
                List<Map<String, Object>> rows = new ArrayList<>();
                if (statement.execute(sql)) {
                    try (ResultSet resultSet = statement.getResultSet()) {
                        rows = readRows(resultSet);
                    }
                }
                LOGGER.debug("Connection '{}' returned {} row(s) in {} ms", connectionName, rows.size(),
                        (System.nanoTime() - started) / 1_000_000);
                return rows;
            } finally {
                rollback(connection, connectionName);
            }
        }
    }

    private static void rollback(Connection connection, String connectionName) {
        try {
            connection.rollback();
        } catch (SQLException ex) {
            LOGGER.warn("Rollback failed on connection '{}': {}", connectionName, ex.getMessage());
        }
    }

    private List<Map<String, Object>> readRows(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(metaData.getColumnLabel(i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1), toJsonValue(resultSet.getObject(i)));
            }
            rows.add(row);
        }
        return rows;
    }

    static Object toJsonValue(Object value) throws SQLException {
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof java.util.Date || value instanceof Temporal || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof Clob clob) {
            return clob.getSubString(1, (int) clob.length());
        }
        if (value instanceof Blob blob) {
            return "[BLOB: " + blob.length() + " bytes]";
        }
        if (value instanceof byte[] bytes) {
            return "[BINARY: " + bytes.length + " bytes]";
        }
        return value.toString();
    }
}
