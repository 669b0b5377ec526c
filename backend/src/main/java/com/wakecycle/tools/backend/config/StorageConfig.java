package com.wakecycle.tools.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wakecycle.tools.backend.store.DocumentKey;
import com.wakecycle.tools.backend.store.DocumentStore;
import com.wakecycle.tools.backend.store.FileDocumentStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

@Configuration
public class StorageConfig {

    @Value("${wake-tools.storage.state-path}")
    private String statePath;

    @Value("${wake-tools.storage.backlog-path}")
    private String backlogPath;

    @Value("${wake-tools.storage.accomplishments-path}")
    private String accomplishmentsPath;

    @Bean
    public DocumentStore documentStore(ObjectMapper objectMapper) {
        Map<DocumentKey, Path> locations = new EnumMap<>(DocumentKey.class);
        locations.put(DocumentKey.STATE, Path.of(statePath));
        locations.put(DocumentKey.BACKLOG, Path.of(backlogPath));
        locations.put(DocumentKey.ACCOMPLISHMENTS, Path.of(accomplishmentsPath));
        return new FileDocumentStore(locations, objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
