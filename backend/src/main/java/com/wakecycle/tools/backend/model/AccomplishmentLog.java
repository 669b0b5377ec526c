package com.wakecycle.tools.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Singleton append-only document of accomplishments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccomplishmentLog {

    @Builder.Default
    private List<AccomplishmentEntry> accomplishments = new ArrayList<>();

    public List<AccomplishmentEntry> entries() {
        if (accomplishments == null) {
            accomplishments = new ArrayList<>();
        }
        return accomplishments;
    }
}
