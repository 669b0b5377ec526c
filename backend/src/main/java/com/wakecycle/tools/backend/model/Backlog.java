package com.wakecycle.tools.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Singleton document holding every task in insertion order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Backlog {

    @Builder.Default
    private List<Task> tasks = new ArrayList<>();

    /**
     * The task list, created on first access when the document carried none.
     */
    public List<Task> tasks() {
        if (tasks == null) {
            tasks = new ArrayList<>();
        }
        return tasks;
    }
}
