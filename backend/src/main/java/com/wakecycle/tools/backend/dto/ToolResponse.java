package com.wakecycle.tools.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement returned by tools that produce no data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResponse {

    @Builder.Default
    private boolean success = true;

    private String message;

    public static ToolResponse ok(String message) {
        return ToolResponse.builder().message(message).build();
    }
}
