package com.wakecycle.tools.backend.dto;

import com.wakecycle.tools.backend.model.Impact;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Completed piece of work")
public class LogAccomplishmentRequest {

    @NotBlank
    @Schema(description = "Category of work", example = "research")
    private String category;

    @NotNull
    @Schema(description = "What was accomplished")
    private String description;

    @NotNull
    @Schema(description = "Impact level: low, medium, high", example = "medium")
    private Impact impact;

    @Builder.Default
    @Schema(description = "Created artifacts")
    private List<String> artifacts = new ArrayList<>();
}
