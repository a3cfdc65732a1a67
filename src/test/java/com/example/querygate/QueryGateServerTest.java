package com.example.querygate;

import com.example.querygate.config.PropertiesConnectionSettingsProvider;
import com.example.querygate.tools.DatabaseQueryTool;
import com.example.querygate.tools.Tool;
import com.example.querygate.tools.ToolRegistry;
import com.example.querygate.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryGateServerTest {
    private static final String URL = "jdbc:h2:mem:query_gate_server_test;DB_CLOSE_DELAY=-1";

    @TempDir
    Path tempDir;

    private Connection keepAlive;
    private Path configFile;
    private QueryGateServer server;

    @BeforeEach
    void setUp() throws Exception {
        keepAlive = DriverManager.getConnection(URL, "sa", "");
        try (Statement statement = keepAlive.createStatement()) {
            statement.execute("CREATE TABLE arpg_users (id INT PRIMARY KEY, name VARCHAR(50))");
            statement.execute("CREATE TABLE arpg_status (id INT PRIMARY KEY, type VARCHAR(20))");
            statement.execute("INSERT INTO arpg_users VALUES (1, 'status'), (2, 'Grace')");
            statement.execute("INSERT INTO arpg_status VALUES (1, 'status'), (2, 'archived')");
        }
        configFile = tempDir.resolve("query-gate.properties");
        writeConfig("arpg_");
        server = new QueryGateServer(new PropertiesConnectionSettingsProvider(configFile));
    }

    @AfterEach
    void tearDown() throws Exception {
        try (Statement statement = keepAlive.createStatement()) {
            statement.execute("DROP ALL OBJECTS");
        }
        keepAlive.close();
    }

    @Test
    void registersDatabaseQueryTool() {
        ToolRegistry registry = server.getRegistry();

        assertEquals(1, registry.list().size());
        assertEquals(DatabaseQueryTool.NAME, registry.require(DatabaseQueryTool.NAME).getName());
        assertThrows(IllegalArgumentException.class, () -> registry.require("tinker"));
        assertThrows(IllegalStateException.class, () -> registry.register(registry.list().get(0)));
    }

    @Test
    void runsPrefixedQueryEndToEnd() {
        McpSchema.CallToolResult result = call(Map.of(
                "query", "SELECT u.id, u.name FROM users AS u WHERE u.name = 'status' ORDER BY u.id",
                "tables", List.of("users")
        ));

        assertFalse(result.isError());
        assertEquals("[{\"ID\":1,\"NAME\":\"status\"}]", text(result));
    }

    @Test
    void keepsLiteralMatchingTableNameEndToEnd() {
        McpSchema.CallToolResult result = call(Map.of(
                "query", "SELECT COUNT(*) AS n FROM status WHERE type = 'status'",
                "tables", List.of("status")
        ));

        assertFalse(result.isError());
        assertEquals("[{\"N\":1}]", text(result));
    }

    @Test
    void picksUpConfigurationChangesBetweenCalls() throws Exception {
        writeConfig("");

        McpSchema.CallToolResult result = call(Map.of("query", "SELECT * FROM users", "tables", List.of("users")));

        assertTrue(result.isError());
        assertTrue(text(result).startsWith("Query failed: "));
        assertTrue(text(result).contains("USERS"));
    }

    @Test
    void reportsRejectionsVerbatim() {
        McpSchema.CallToolResult rejected = call(Map.of("query", "DROP TABLE users"));
        McpSchema.CallToolResult empty = call(Map.of("query", "  "));

        assertTrue(rejected.isError());
        assertEquals("Only read-only queries are allowed (SELECT, SHOW, EXPLAIN, DESCRIBE, DESC, WITH … SELECT).", text(rejected));
        assertTrue(empty.isError());
        assertEquals("Please pass a valid query", text(empty));
    }

    @Test
    void leavesDataUntouchedWhenStatementsAreStacked() throws Exception {
        McpSchema.CallToolResult result = call(Map.of("query", "SELECT 1; DELETE FROM arpg_users"));

        assertTrue(result.isError());
        try (Statement statement = keepAlive.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM arpg_users")) {
            resultSet.next();
            assertEquals(2, resultSet.getInt(1));
        }
    }

    @Test
    void reportsUnknownConnection() {
        McpSchema.CallToolResult result = call(Map.of("query", "SELECT 1", "database", "ghost"));

        assertTrue(result.isError());
        assertEquals("Query failed: Database connection [ghost] not configured.", text(result));
    }

    @Test
    void treatsMissingArgumentsAsEmptyQuery() {
        McpSchema.CallToolResult result = server.executeTool(server.getRegistry().require(DatabaseQueryTool.NAME), null);

        assertEquals("Please pass a valid query", text(result));
    }

    @Test
    void reportsUnexpectedToolFailures() {
        Tool failing = new Tool() {
            @Override
            public String getName() {
                return "failing";
            }

            @Override
            public String getDescription() {
                return "Always throws.";
            }

            @Override
            public ObjectNode getInputSchema() {
                return null;
            }

            @Override
            public ToolResult call(JsonNode arguments) {
                throw new IllegalStateException("boom");
            }
        };

        McpSchema.CallToolResult result = server.executeTool(failing, Map.of());

        assertTrue(result.isError());
        assertEquals("Tool execution failed: boom", text(result));
    }

    @Test
    void rendersTextualContentAsIs() {
        Tool echo = new Tool() {
            @Override
            public String getName() {
                return "echo";
            }

            @Override
            public String getDescription() {
                return "Echoes its input.";
            }

            @Override
            public ObjectNode getInputSchema() {
                return null;
            }

            @Override
            public ToolResult call(JsonNode arguments) {
                return ToolResult.success(arguments.get("value"));
            }
        };

        McpSchema.CallToolResult result = server.executeTool(echo, Map.of("value", "hello"));

        assertFalse(result.isError());
        assertEquals("hello", text(result));
    }

    private McpSchema.CallToolResult call(Map<String, Object> arguments) {
        return server.executeTool(server.getRegistry().require(DatabaseQueryTool.NAME), arguments);
    }

    private static String text(McpSchema.CallToolResult result) {
        return ((McpSchema.TextContent) result.content().get(0)).text();
    }

    private void writeConfig(String prefix) throws Exception {
        Files.writeString(configFile, String.join("\n",
                "database.default=main",
                "database.connections.main.url=" + URL,
                "database.connections.main.username=sa",
                "database.connections.main.password=",
                "database.connections.main.prefix=" + prefix
        ) + "\n");
    }
}
