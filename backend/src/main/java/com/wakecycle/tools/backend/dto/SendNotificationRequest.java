package com.wakecycle.tools.backend.dto;

import com.wakecycle.tools.backend.model.Priority;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Notification to the principal")
public class SendNotificationRequest {

    public static final String DEFAULT_CHANNEL = "webhook";

    @NotNull
    @Schema(description = "Notification message")
    private String message;

    @NotNull
    @Schema(description = "Priority: low, normal, high, urgent", example = "high")
    private Priority priority;

    @Builder.Default
    @Schema(description = "Notification channel", example = DEFAULT_CHANNEL)
    private String channel = DEFAULT_CHANNEL;
}
