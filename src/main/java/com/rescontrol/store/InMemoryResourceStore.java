package com.rescontrol.store;

import com.rescontrol.contract.Resource;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Outlives an {@code AdmissionEngine} instance, which is enough to
 * exercise restart recovery without touching disk.
 */
public class InMemoryResourceStore implements ResourceStore {

    private final ConcurrentHashMap<String, Resource> resources = new ConcurrentHashMap<>();

    @Override
    public Optional<Resource> load(String tenant, String id) {
        return Optional.ofNullable(resources.get(tenant + ":" + id));
    }

    @Override
    public void save(Resource resource) {
        resources.put(resource.tenantId(), resource);
    }

    public int size() {
        return resources.size();
    }
}
