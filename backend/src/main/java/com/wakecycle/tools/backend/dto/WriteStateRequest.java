package com.wakecycle.tools.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Complete agent state to persist")
public class WriteStateRequest {

    @NotNull
    @Schema(description = "Complete state object to persist; server-owned fields are ignored")
    private Map<String, Object> state;
}
