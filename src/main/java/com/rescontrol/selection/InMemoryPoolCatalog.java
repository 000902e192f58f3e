package com.rescontrol.selection;

import com.rescontrol.contract.NotFoundException;
import com.rescontrol.contract.ResourcePool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog held in memory. Iteration order per tenant is insertion order; replacing a pool keeps
 * its position. Updates are visible to later selections only.
 */
public class InMemoryPoolCatalog implements PoolCatalog {

    private final ConcurrentHashMap<String, Map<String, ResourcePool>> poolsByTenant = new ConcurrentHashMap<>();

    public InMemoryPoolCatalog() {
    }

    public InMemoryPoolCatalog(Collection<ResourcePool> pools) {
        pools.forEach(this::put);
    }

    public void put(ResourcePool pool) {
        poolsByTenant.compute(pool.tenant(), (tenant, pools) -> {
            Map<String, ResourcePool> updated = pools == null ? new LinkedHashMap<>() : new LinkedHashMap<>(pools);
            updated.put(pool.id(), pool);
            return updated;
        });
    }

    public void remove(String tenant, String id) {
        poolsByTenant.computeIfPresent(tenant, (t, pools) -> {
            Map<String, ResourcePool> updated = new LinkedHashMap<>(pools);
            updated.remove(id);
            return updated.isEmpty() ? null : updated;
        });
    }

    @Override
    public List<ResourcePool> getPools(String tenant) {
        Map<String, ResourcePool> pools = poolsByTenant.get(tenant);
        if (pools == null || pools.isEmpty()) {
            throw new NotFoundException("no resource pools configured for tenant: " + tenant);
        }
        return new ArrayList<>(pools.values());
    }

    @Override
    public Optional<ResourcePool> getPool(String tenant, String id) {
        Map<String, ResourcePool> pools = poolsByTenant.get(tenant);
        return pools == null ? Optional.empty() : Optional.ofNullable(pools.get(id));
    }

    @Override
    public Set<String> tenants() {
        return Set.copyOf(poolsByTenant.keySet());
    }
}
