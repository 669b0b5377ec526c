package com.wakecycle.tools.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Impact level of an accomplishment.
 */
public enum Impact {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Impact fromValue(String value) {
        if (value != null) {
            for (Impact impact : values()) {
                if (impact.value().equalsIgnoreCase(value.trim())) {
                    return impact;
                }
            }
        }
        throw new IllegalArgumentException("Unknown impact: " + value);
    }
}
