package com.example.querygate.tools;

import java.util.List;
import java.util.LinkedHashMap;
import java.util.Map;

public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ToolRegistry register(Tool tool) {
        Tool existing = tools.putIfAbsent(tool.getName(), tool);
        if (existing != null) {
            throw new IllegalStateException("Tool '" + tool.getName() + "' is already registered");
        }
        return this;
    }

    public Tool require(String name) {
        Tool tool = tools.get(name);
        if (tool == null) {
            throw new IllegalArgumentException("Unknown tool '" + name + "'");
        }
        return tool;
    }

    public List<Tool> list() {
        return List.copyOf(tools.values());
    }
}
