package com.rescontrol.store;

import com.rescontrol.contract.Resource;

import java.util.Optional;

/**
 * Durable home of the live state of {@code Stored} pools.
 * Absence on first use is an empty result, never an error.
 */
public interface ResourceStore {

    Optional<Resource> load(String tenant, String id);

    /**
     * @throws ResourceStoreException if the state could not be written
     */
    void save(Resource resource);
}
