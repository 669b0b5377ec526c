package com.wakecycle.tools.backend.config;

import com.wakecycle.tools.backend.model.DefaultDocuments;
import com.wakecycle.tools.backend.store.DocumentKey;
import com.wakecycle.tools.backend.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Writes the default document for every key that has no file yet, so a fresh
 * deployment starts from the same shapes the tools would fall back to.
 */
@Component
public class DocumentInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DocumentInitializer.class);

    private final DocumentStore documentStore;

    public DocumentInitializer(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        initializeMissing();
    }

    public void initializeMissing() {
        for (DocumentKey key : DocumentKey.values()) {
            log.info("{} path: {}", key.label(), documentStore.pathOf(key));
            if (!documentStore.exists(key)) {
                documentStore.save(key, DefaultDocuments.forKey(key));
                log.info("Initialized {} file", key.label());
            }
        }
    }
}
