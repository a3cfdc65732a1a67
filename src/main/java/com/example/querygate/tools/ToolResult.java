package com.example.querygate.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a tool call: either a JSON payload or a single user-facing error message.
 */
public record ToolResult(JsonNode content, String errorMessage) {

    public static ToolResult success(JsonNode content) {
        return new ToolResult(content, null);
    }

    public static ToolResult error(String message) {
        return new ToolResult(null, message);
    }

    public boolean isError() {
        return errorMessage != null;
    }
}
