package com.wakecycle.tools.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A backlog entry.
 *
 * <p>{@code priority}, {@code status} and the timestamps are kept as the raw strings found in the
 * document so that hand-edited values survive a rewrite; {@link Priority#rankOf(String)} handles
 * unknown priorities.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "title", "description", "priority", "status", "created_at", "updated_at",
        "completed_at", "notes"})
public class Task {

    private String id;
    private String title;
    private String description;
    private String priority;
    private String status;

    private String createdAt;
    private String updatedAt;
    private String completedAt;

    private String notes;

    public boolean hasStatus(String candidate) {
        return candidate != null && candidate.equals(status);
    }
}
