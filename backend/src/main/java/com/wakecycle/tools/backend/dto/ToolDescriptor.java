package com.wakecycle.tools.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * MCP-style tool description. {@code inputSchema} is a JSON Schema object.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolDescriptor {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;
}
