package com.wakecycle.tools.backend.service;

import com.wakecycle.tools.backend.dto.ToolDescriptor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The tools this server exposes, described in MCP form.
 */
@Component
public class ToolCatalog {

    private final List<ToolDescriptor> tools = List.of(
            tool("read_state", "Read agent state from persistent storage", properties()),
            tool("write_state", "Update agent state",
                    properties("state", "object"), "state"),
            tool("read_backlog", "Read task backlog",
                    properties("status_filter", "string")),
            tool("update_task", "Update task status",
                    properties("task_id", "string", "status", "string", "notes", "string"), "task_id", "status"),
            tool("add_task", "Add new task to backlog",
                    properties("title", "string", "description", "string", "priority", "string"),
                    "title", "description", "priority"),
            tool("log_accomplishment", "Log completed work",
                    properties("category", "string", "description", "string", "impact", "string",
                            "artifacts", "array"),
                    "category", "description", "impact"),
            tool("send_notification", "Send notification to principal",
                    properties("message", "string", "priority", "string", "channel", "string"),
                    "message", "priority"));

    public List<ToolDescriptor> getTools() {
        return tools;
    }

    public List<String> getToolNames() {
        return tools.stream().map(ToolDescriptor::getName).collect(Collectors.toList());
    }

    private static ToolDescriptor tool(String name, String description, Map<String, Object> properties,
            String... required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (required.length > 0) {
            schema.put("required", List.of(required));
        }
        return ToolDescriptor.builder()
                .name(name)
                .description(description)
                .inputSchema(schema)
                .build();
    }

    // Alternating property name / JSON type pairs
    private static Map<String, Object> properties(String... nameTypePairs) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i + 1 < nameTypePairs.length; i += 2) {
            properties.put(nameTypePairs[i], Map.of("type", nameTypePairs[i + 1]));
        }
        return properties;
    }
}
