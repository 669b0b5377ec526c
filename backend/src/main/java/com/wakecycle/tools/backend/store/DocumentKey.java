package com.wakecycle.tools.backend.store;

/**
 * The named documents managed by the {@link DocumentStore}.
 */
public enum DocumentKey {
    STATE("state"),
    BACKLOG("backlog"),
    ACCOMPLISHMENTS("accomplishments");

    private final String label;

    DocumentKey(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
