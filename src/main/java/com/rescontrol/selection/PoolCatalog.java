package com.rescontrol.selection;

import com.rescontrol.contract.ResourcePool;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read side of the profile catalog.
 */
public interface PoolCatalog {

    /**
     * Pools of a tenant in a stable iteration order.
     *
     * @throws com.rescontrol.contract.NotFoundException if the tenant has no pools
     */
    List<ResourcePool> getPools(String tenant);

    Optional<ResourcePool> getPool(String tenant, String id);

    Set<String> tenants();
}
