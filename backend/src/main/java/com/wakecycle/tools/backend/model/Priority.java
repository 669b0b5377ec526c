package com.wakecycle.tools.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Priority shared by tasks and notifications. Declaration order is the sort order.
 */
public enum Priority {
    URGENT,
    HIGH,
    NORMAL,
    LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether notifications at this priority are escalated to the webhook.
     */
    public boolean isElevated() {
        return this == URGENT || this == HIGH;
    }

    @JsonCreator
    public static Priority fromValue(String value) {
        if (value != null) {
            for (Priority priority : values()) {
                if (priority.value().equalsIgnoreCase(value.trim())) {
                    return priority;
                }
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }

    /**
     * Sort rank of a stored priority string; unknown or missing values rank as {@link #NORMAL}.
     */
    public static int rankOf(String value) {
        if (value != null) {
            for (Priority priority : values()) {
                if (priority.value().equals(value)) {
                    return priority.ordinal();
                }
            }
        }
        return NORMAL.ordinal();
    }
}
