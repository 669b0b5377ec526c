package com.wakecycle.tools.backend.model;

import com.wakecycle.tools.backend.store.DocumentKey;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Documents used when nothing (or nothing readable) has been persisted yet.
 * Each call returns a fresh mutable instance.
 */
public final class DefaultDocuments {

    public static final String STATE_VERSION = "1.0";
    public static final String INITIAL_FOCUS = "Initial setup";

    private DefaultDocuments() {
    }

    public static AgentState state() {
        Map<String, Boolean> capabilities = new LinkedHashMap<>();
        capabilities.put("read_state", true);
        capabilities.put("write_state", true);
        capabilities.put("read_backlog", true);
        capabilities.put("update_task", true);
        capabilities.put("log_accomplishment", true);
        capabilities.put("send_notification", true);

        Map<String, Long> metrics = new LinkedHashMap<>();
        for (StateMetric metric : StateMetric.values()) {
            metrics.put(metric.key(), 0L);
        }

        return AgentState.builder()
                .version(STATE_VERSION)
                .wakeCount(0)
                .currentFocus(INITIAL_FOCUS)
                .activeTasks(new ArrayList<>())
                .capabilities(capabilities)
                .metrics(metrics)
                .build();
    }

    public static Backlog backlog() {
        return new Backlog(new ArrayList<>());
    }

    public static AccomplishmentLog accomplishments() {
        return new AccomplishmentLog(new ArrayList<>());
    }

    /**
     * Default document for a key, as written on first start.
     */
    public static Object forKey(DocumentKey key) {
        return switch (key) {
            case STATE -> state();
            case BACKLOG -> backlog();
            case ACCOMPLISHMENTS -> accomplishments();
        };
    }
}
