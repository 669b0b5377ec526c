package com.wakecycle.tools.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.wakecycle.tools.backend.model.TaskStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Task status change")
public class UpdateTaskRequest {

    @NotBlank
    @Schema(description = "ID of task to update", example = "task-001")
    private String taskId;

    @NotNull
    @Schema(description = "New status: pending, in_progress, completed", example = "in_progress")
    private TaskStatus status;

    @Schema(description = "Optional progress notes")
    private String notes;
}
