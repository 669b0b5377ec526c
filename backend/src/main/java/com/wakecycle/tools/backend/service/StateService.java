package com.wakecycle.tools.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wakecycle.tools.backend.model.AgentState;
import com.wakecycle.tools.backend.model.DefaultDocuments;
import com.wakecycle.tools.backend.model.StateMetric;
import com.wakecycle.tools.backend.model.Timestamps;
import com.wakecycle.tools.backend.store.DocumentKey;
import com.wakecycle.tools.backend.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Owns the agent state document.
 */
@Service
public class StateService {

    private static final Logger log = LoggerFactory.getLogger(StateService.class);

    // Keys the server owns in the stored state
    public static final Set<String> PROTECTED_FIELDS = Set.of("version", "wake_count", "created_at", "last_wake");

    private final DocumentStore documentStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StateService(DocumentStore documentStore, ObjectMapper objectMapper, Clock clock) {
        this.documentStore = documentStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Load the state and record a wake: bumps the wake count, stamps last wake and,
     * on the very first wake, the creation time.
     */
    public AgentState readState() {
        log.info("Reading state");
        AgentState state = documentStore.update(DocumentKey.STATE, AgentState.class, DefaultDocuments::state,
                current -> {
                    String now = Timestamps.now(clock);
                    current.setWakeCount(current.getWakeCount() + 1);
                    current.setLastWake(now);
                    if (current.getCreatedAt() == null) {
                        current.setCreatedAt(now);
                    }
                    return current;
                });
        log.info("State loaded: wake #{}, focus: {}", state.getWakeCount(), state.getCurrentFocus());
        return state;
    }

    /**
     * Replace the state with the given document. Server-owned fields are copied over from the stored
     * state; whatever the caller sent for them is discarded.
     */
    public AgentState writeState(AgentState incoming) {
        log.info("Writing state");
        AgentState saved = documentStore.replace(DocumentKey.STATE, AgentState.class, DefaultDocuments::state,
                existing -> {
                    incoming.setVersion(existing.getVersion() != null
                            ? existing.getVersion()
                            : DefaultDocuments.STATE_VERSION);
                    incoming.setWakeCount(existing.getWakeCount());
                    incoming.setCreatedAt(existing.getCreatedAt());
                    incoming.setLastWake(existing.getLastWake());
                    return incoming;
                });
        log.info("State updated: focus: {}", saved.getCurrentFocus());
        return saved;
    }

    /**
     * Replace the state with a client-supplied JSON object. Server-owned keys are dropped before the
     * object is bound, so their values never matter.
     *
     * @throws IllegalArgumentException if the remaining fields do not fit the state document
     */
    public AgentState writeStateDocument(Map<String, Object> document) {
        Map<String, Object> fields = new LinkedHashMap<>(document);
        fields.keySet().removeAll(PROTECTED_FIELDS);
        return writeState(objectMapper.convertValue(fields, AgentState.class));
    }

    /**
     * Increment one of the state counters.
     */
    public long bumpMetric(StateMetric metric) {
        long value = documentStore.update(DocumentKey.STATE, AgentState.class, DefaultDocuments::state,
                state -> {
                    state.incrementMetric(metric);
                    return state.metric(metric);
                });
        log.debug("Metric {} is now {}", metric.key(), value);
        return value;
    }
}
