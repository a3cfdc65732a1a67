package com.example.querygate.db;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

public interface QueryExecutor {
    /**
     * Runs {@code sql} on the named connection and returns every row as a column-ordered map.
     */
    List<Map<String, Object>> select(String connectionName, String sql) throws SQLException;
}
