package com.wakecycle.tools.backend.service;

import com.wakecycle.tools.backend.model.AccomplishmentEntry;
import com.wakecycle.tools.backend.model.AccomplishmentLog;
import com.wakecycle.tools.backend.model.DefaultDocuments;
import com.wakecycle.tools.backend.model.Impact;
import com.wakecycle.tools.backend.model.StateMetric;
import com.wakecycle.tools.backend.model.Timestamps;
import com.wakecycle.tools.backend.store.DocumentKey;
import com.wakecycle.tools.backend.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Service
public class AccomplishmentService {

    private static final Logger log = LoggerFactory.getLogger(AccomplishmentService.class);

    private final DocumentStore documentStore;
    private final StateService stateService;
    private final Clock clock;

    public AccomplishmentService(DocumentStore documentStore, StateService stateService, Clock clock) {
        this.documentStore = documentStore;
        this.stateService = stateService;
        this.clock = clock;
    }

    /**
     * Append an entry to the accomplishment log and bump {@code total_accomplishments}.
     */
    public AccomplishmentEntry logAccomplishment(String category, String description, Impact impact,
            List<String> artifacts) {
        log.info("Logging accomplishment: {}",
                description.length() > 50 ? description.substring(0, 50) + "..." : description);

        AccomplishmentEntry entry = AccomplishmentEntry.builder()
                .timestamp(Timestamps.now(clock))
                .category(category)
                .description(description)
                .impact(impact.value())
                .artifacts(artifacts != null ? new ArrayList<>(artifacts) : new ArrayList<>())
                .build();

        documentStore.update(DocumentKey.ACCOMPLISHMENTS, AccomplishmentLog.class, DefaultDocuments::accomplishments,
                accomplishments -> accomplishments.entries().add(entry));

        stateService.bumpMetric(StateMetric.TOTAL_ACCOMPLISHMENTS);

        log.info("Accomplishment logged ({} impact)", impact.value());
        return entry;
    }
}
