package com.example.querygate;

import com.example.querygate.config.ConnectionSettingsProvider;
import com.example.querygate.config.PropertiesConnectionSettingsProvider;
import com.example.querygate.db.JdbcQueryExecutor;
import com.example.querygate.tools.DatabaseQueryTool;
import com.example.querygate.tools.Tool;
import com.example.querygate.tools.ToolRegistry;
import com.example.querygate.tools.ToolResult;
import com.example.querygate.util.InstallLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MCP server bootstrap that exposes the read-only database query tool over stdio.
 */
public class QueryGateServer {

    private static final String SERVER_NAME = "query-gate-mcp";
    private static final String SERVER_VERSION = "0.1.0";
    private static final String LOG_FILE_NAME = "query-gate.log";

    private static final String LOG_FILE_PATH = configureSimpleLogger();
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryGateServer.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final McpJsonMapper mcpJsonMapper = McpJsonMapper.getDefault();
    private final ToolRegistry registry = new ToolRegistry();

    public QueryGateServer(ConnectionSettingsProvider settingsProvider) {
        registry.register(new DatabaseQueryTool(mapper, settingsProvider, new JdbcQueryExecutor(settingsProvider)));
    }

    public static void main(String[] args) {
        PropertiesConnectionSettingsProvider settingsProvider = PropertiesConnectionSettingsProvider.locate();
        LOGGER.info("Reading connection settings from {}", settingsProvider.getFile() != null
                ? settingsProvider.getFile().toAbsolutePath()
                : "classpath:" + PropertiesConnectionSettingsProvider.CONFIG_FILE_NAME);
        new QueryGateServer(settingsProvider).start();
    }

    public void start() {
        List<McpServerFeatures.SyncToolSpecification> tools = registry.list().stream()
                .map(this::toToolSpecification)
                .toList();

        if (LOG_FILE_PATH != null) {
            LOGGER.info("Logging MCP server output to {}", LOG_FILE_PATH);
        }

        StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(mcpJsonMapper);

        McpSyncServer server = McpServer
                .sync(transportProvider)
                .serverInfo(new McpSchema.Implementation(SERVER_NAME, SERVER_VERSION))
                .jsonMapper(mcpJsonMapper)
                .tools(tools)
                .build();

        keepServerAlive(server, tools.size());
    }

    ToolRegistry getRegistry() {
        return registry;
    }

    private static String configureSimpleLogger() {
        String existing = System.getProperty("org.slf4j.simpleLogger.logFile");
        if (existing != null && !existing.isBlank()) {
            return existing;
        }

        try {
            Path logFile = InstallLocation.resolve(QueryGateServer.class, LOG_FILE_NAME);
            if (logFile == null) {
                return null;
            }
            Path parent = logFile.getParent();
            if (parent != null && Files.notExists(parent)) {
                Files.createDirectories(parent);
            }
            String absolutePath = logFile.toAbsolutePath().toString();
            System.setProperty("org.slf4j.simpleLogger.logFile", absolutePath);
            return absolutePath;
        } catch (Exception ex) {
            System.err.println("Failed to configure log file output: " + ex.getMessage());
            return null;
        }
    }

    private void keepServerAlive(McpSyncServer server, int toolCount) {
        CountDownLatch shutdown = new CountDownLatch(1);
        AtomicBoolean closed = new AtomicBoolean(false);

        Runnable shutdownHook = () -> {
            if (closed.compareAndSet(false, true)) {
                try {
                    LOGGER.info("Shutting down MCP server");
                    server.closeGracefully();
                } catch (Exception e) {
                    LOGGER.warn("Error while shutting down MCP server", e);
                } finally {
                    shutdown.countDown();
                }
            }
        };

        Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook, "query-gate-shutdown"));

        LOGGER.info("{} started with {} tool(s); awaiting requests...", SERVER_NAME, toolCount);
        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("MCP server interrupted; shutting down");
            shutdownHook.run();
        }
    }

    private McpServerFeatures.SyncToolSpecification toToolSpecification(Tool tool) {
        McpSchema.Tool descriptor = McpSchema.Tool.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(mcpJsonMapper, tool.getInputSchema().toString())
                .build();
        return McpServerFeatures.SyncToolSpecification.builder()
                .tool(descriptor)
                .callHandler((exchange, request) -> executeTool(tool, request.arguments()))
                .build();
    }

    McpSchema.CallToolResult executeTool(Tool tool, Map<String, Object> arguments) {
        JsonNode argumentsNode = arguments == null ? mapper.createObjectNode() : mapper.valueToTree(arguments);
        try {
            ToolResult result = tool.call(argumentsNode);
            if (result.isError()) {
                return McpSchema.CallToolResult.builder()
                        .isError(true)
                        .addTextContent(result.errorMessage())
                        .build();
            }
            McpSchema.CallToolResult.Builder builder = McpSchema.CallToolResult.builder().isError(false);
            JsonNode content = result.content();
            if (content == null || content.isNull()) {
                builder.addTextContent("null");
            } else {
                builder.structuredContent(mapper.convertValue(content, Object.class));
                builder.addTextContent(renderResultText(content));
            }
            return builder.build();
        } catch (Exception ex) {
            LOGGER.error("Tool '{}' execution failed", tool.getName(), ex);
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            return McpSchema.CallToolResult.builder()
                    .isError(true)
                    .addTextContent("Tool execution failed: " + message)
                    .build();
        }
    }

    private String renderResultText(JsonNode result) {
        if (result.isTextual()) {
            return result.asText();
        }
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return result.toString();
        }
    }
}
