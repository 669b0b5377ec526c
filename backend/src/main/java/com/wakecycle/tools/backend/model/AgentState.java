package com.wakecycle.tools.backend.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Singleton document holding the agent's working context between wake cycles.
 *
 * <p>{@code version}, {@code wakeCount}, {@code createdAt} and {@code lastWake} are owned by the
 * server. Top-level fields this class does not know about are kept and written back as-is.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"version", "wake_count", "created_at", "last_wake", "current_focus",
        "active_tasks", "capabilities", "metrics"})
public class AgentState {

    private String version;

    private long wakeCount;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String createdAt;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String lastWake;

    private String currentFocus;

    // Opaque references chosen by the agent
    private List<Object> activeTasks;

    private Map<String, Boolean> capabilities;

    private Map<String, Long> metrics;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private Map<String, Object> additionalProperties = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String name, Object value) {
        additionalProperties.put(name, value);
    }

    /**
     * Current value of a metric counter, 0 when it has never been recorded.
     */
    public long metric(StateMetric metric) {
        if (metrics == null) {
            return 0L;
        }
        Long value = metrics.get(metric.key());
        return value != null ? value : 0L;
    }

    public void incrementMetric(StateMetric metric) {
        if (metrics == null) {
            metrics = new LinkedHashMap<>();
        }
        metrics.merge(metric.key(), 1L, Long::sum);
    }
}
