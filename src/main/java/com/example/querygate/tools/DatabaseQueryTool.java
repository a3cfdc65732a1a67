package com.example.querygate.tools;

import com.example.querygate.config.ConnectionSettings;
import com.example.querygate.config.ConnectionSettingsProvider;
import com.example.querygate.db.QueryExecutor;
import com.example.querygate.sql.Classification;
import com.example.querygate.sql.ReadOnlyClassifier;
import com.example.querygate.sql.TablePrefixer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Executes a read-only SQL query, prefixing the declared tables with the connection's table prefix.
 */
public class DatabaseQueryTool implements Tool {
    public static final String NAME = "database-query";
    static final String QUERY_FAILED_PREFIX = "Query failed: ";

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseQueryTool.class);

    private final ObjectMapper mapper;
    private final ConnectionSettingsProvider settingsProvider;
    private final QueryExecutor executor;

    public DatabaseQueryTool(ObjectMapper mapper, ConnectionSettingsProvider settingsProvider, QueryExecutor executor) {
        this.mapper = mapper;
        this.settingsProvider = settingsProvider;
        this.executor = executor;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Execute a read-only SQL query against the configured database.";
    }

    @Override
    public ObjectNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = mapper.createObjectNode();
        properties.putObject("query")
                .put("type", "string")
                .put("description", "The SQL query to execute. Only read-only queries are allowed (i.e. SELECT, SHOW, EXPLAIN, DESCRIBE).");
        properties.putObject("database")
                .put("type", "string")
                .put("description", "Optional database connection name to use. Defaults to the configured default connection.");
        ObjectNode tables = properties.putObject("tables");
        tables.put("type", "array");
        tables.putObject("items")
                .put("type", "string")
                .put("description", "Table name to prefix (without the prefix, case-sensitive)");
        tables.put("description", "Array of table names in the query that should be prefixed. "
                + "These tables will have the database prefix added automatically. "
                + "Only works when a database prefix is configured. Table names should be provided without the prefix.");
        schema.set("properties", properties);
        ArrayNode required = mapper.createArrayNode();
        required.add("query");
        schema.set("required", required);
        return schema;
    }

    @Override
    public ToolResult call(JsonNode arguments) {
        String query = arguments.path("query").asText("").trim();

        Classification classification = ReadOnlyClassifier.classify(query);
        if (!classification.isAccepted()) {
            LOGGER.debug("Rejected query ({}): {}", classification.verdict(), query);
            return ToolResult.error(classification.message());
        }

        String requestedConnection = arguments.path("database").asText(null);
        List<String> tables = readStringArray(arguments.get("tables"));

        String connectionName = requestedConnection;
        try {
            ConnectionSettings settings = settingsProvider.current();
            connectionName = settings.resolveConnectionName(requestedConnection);
            String prefix = settings.prefixFor(connectionName);
            if (!prefix.isEmpty()) {
                query = TablePrefixer.rewrite(query, tables, prefix);
            }

            List<Map<String, Object>> rows = executor.select(connectionName, query);
            LOGGER.info("Query on connection '{}' returned {} row(s)", connectionName, rows.size());
            return ToolResult.success(mapper.valueToTree(rows));
        } catch (Exception ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            LOGGER.warn("Query on connection '{}' failed: {}", connectionName, message);
            return ToolResult.error(QUERY_FAILED_PREFIX + message);
        }
    }

    private List<String> readStringArray(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode element : node) {
            if (element.isTextual()) {
                values.add(element.asText());
            }
        }
        return values;
    }
}
