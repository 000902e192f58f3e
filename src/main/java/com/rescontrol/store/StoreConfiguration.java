package com.rescontrol.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rescontrol.admission.AdmissionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class StoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StoreConfiguration.class);

    @Bean
    public ResourceStore resourceStore(AdmissionProperties properties, ObjectMapper objectMapper) {
        AdmissionProperties.Store store = properties.getStore();
        return switch (store.getType()) {
            case "memory" -> new InMemoryResourceStore();
            case "file" -> {
                Path root = Path.of(store.getPath());
                log.info("Persisting stored resources under {}", root.toAbsolutePath());
                yield new FileResourceStore(root, objectMapper);
            }
            default -> throw new IllegalStateException("unknown admission.store.type: " + store.getType());
        };
    }
}
