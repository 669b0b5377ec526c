package com.wakecycle.tools.backend.controller;

import com.wakecycle.tools.backend.dto.HealthResponse;
import com.wakecycle.tools.backend.dto.ServerInfoResponse;
import com.wakecycle.tools.backend.dto.ToolCatalogResponse;
import com.wakecycle.tools.backend.service.ToolCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;

@RestController
@Tag(name = "Server", description = "Health and tool discovery")
public class ServerInfoController {

    public static final String SERVER_NAME = "wake-cycle-tools";
    public static final String SERVER_DESCRIPTION = "MCP ToolServer for autonomous agent state management";

    private final ToolCatalog toolCatalog;
    private final Clock clock;

    @Value("${wake-tools.version:1.0.0}")
    private String version;

    public ServerInfoController(ToolCatalog toolCatalog, Clock clock) {
        this.toolCatalog = toolCatalog;
        this.clock = clock;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder()
                .status("healthy")
                .timestamp(OffsetDateTime.now(clock))
                .build());
    }

    @GetMapping("/")
    @Operation(summary = "Server info", description = "Name, version and tool names")
    public ResponseEntity<ServerInfoResponse> info() {
        return ResponseEntity.ok(ServerInfoResponse.builder()
                .name(SERVER_NAME)
                .version(version)
                .description(SERVER_DESCRIPTION)
                .tools(toolCatalog.getToolNames())
                .build());
    }

    @GetMapping("/mcp/tools")
    @Operation(summary = "List tools", description = "Tool descriptions with JSON Schema inputs")
    public ResponseEntity<ToolCatalogResponse> listTools() {
        return ResponseEntity.ok(ToolCatalogResponse.builder()
                .tools(toolCatalog.getTools())
                .build());
    }
}
