package com.rescontrol.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rescontrol.contract.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each resource as a JSON document at {@code <root>/<tenant>/<id>.json}.
 * Writes go to a temporary sibling first and are moved into place atomically.
 */
public class FileResourceStore implements ResourceStore {

    private static final Logger log = LoggerFactory.getLogger(FileResourceStore.class);

    private final Path root;
    private final ObjectMapper objectMapper;

    public FileResourceStore(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Resource> load(String tenant, String id) {
        Path file = fileFor(tenant, id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), Resource.class));
        } catch (IOException ex) {
            throw new ResourceStoreException("failed reading resource " + tenant + ":" + id, ex);
        }
    }

    @Override
    public void save(Resource resource) {
        Path file = fileFor(resource.tenant(), resource.id());
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), resource);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved resource {} with {} usages to {}", resource.tenantId(), resource.usages().size(), file);
        } catch (IOException ex) {
            throw new ResourceStoreException("failed saving resource " + resource.tenantId(), ex);
        }
    }

    private Path fileFor(String tenant, String id) {
        return root.resolve(sanitize(tenant)).resolve(sanitize(id) + ".json");
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
