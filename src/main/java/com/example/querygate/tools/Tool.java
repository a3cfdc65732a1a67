package com.example.querygate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public interface Tool {
    String getName();

    String getDescription();

    ObjectNode getInputSchema();

    /**
     * Handles one invocation. Expected failures are returned as {@link ToolResult#error(String)};
     * thrown exceptions are reported by the server as unexpected tool failures.
     */
    ToolResult call(JsonNode arguments) throws Exception;
}
