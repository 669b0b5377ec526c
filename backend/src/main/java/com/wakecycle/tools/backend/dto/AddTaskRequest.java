package com.wakecycle.tools.backend.dto;

import com.wakecycle.tools.backend.model.Priority;
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
@Schema(description = "New backlog task")
public class AddTaskRequest {

    @NotBlank
    @Schema(description = "Task title", example = "Review open pull requests")
    private String title;

    @NotNull
    @Schema(description = "Task description")
    private String description;

    @NotNull
    @Schema(description = "Priority: low, normal, high, urgent", example = "normal")
    private Priority priority;
}
