package com.wakecycle.tools.backend.model;

/**
 * Counters kept under {@code metrics} in the agent state.
 */
public enum StateMetric {
    TOTAL_ACCOMPLISHMENTS("total_accomplishments"),
    TASKS_COMPLETED("tasks_completed"),
    NOTIFICATIONS_SENT("notifications_sent");

    private final String key;

    StateMetric(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
