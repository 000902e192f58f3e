package com.rescontrol.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the live reservations held against one pool.
 *
 * @param usages usage-ID to reservation
 * @param ttlIdx IDs of the expiring usages, soonest expiry first
 */
public record Resource(
    @JsonProperty("tenant") String tenant,
    @JsonProperty("id") String id,
    @JsonProperty("usages") Map<String, ResourceUsage> usages,
    @JsonProperty("ttl_idx") List<String> ttlIdx
) {

    public Resource {
        usages = usages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usages));
        ttlIdx = ttlIdx == null ? List.of() : List.copyOf(ttlIdx);
    }

    public static Resource empty(String tenant, String id) {
        return new Resource(tenant, id, Map.of(), List.of());
    }

    @JsonProperty(value = "total_usage", access = JsonProperty.Access.READ_ONLY)
    public double totalUsage() {
        return usages.values().stream().mapToDouble(ResourceUsage::units).sum();
    }

    public String tenantId() {
        return tenant + ":" + id;
    }
}
