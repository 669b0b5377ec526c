package com.wakecycle.tools.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a backlog task.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        if (value != null) {
            for (TaskStatus status : values()) {
                if (status.value().equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
