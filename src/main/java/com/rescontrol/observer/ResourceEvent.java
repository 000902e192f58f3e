package com.rescontrol.observer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rescontrol.contract.ResourcePool;
import com.rescontrol.contract.ResourceUsage;

import java.time.Instant;
import java.util.List;

/**
 * Notification that a pool's usage changed after a committed allocation or release.
 */
public record ResourceEvent(
    @JsonProperty("event_type") Type eventType,
    @JsonProperty("tenant") String tenant,
    @JsonProperty("pool_id") String poolId,
    @JsonProperty("usage") ResourceUsage usage,
    @JsonProperty("total_usage") double totalUsage,
    @JsonProperty("threshold_ids") List<String> thresholdIds,
    @JsonProperty("occurred_at") Instant occurredAt
) {

    public enum Type {
        ALLOCATED,
        RELEASED
    }

    public static ResourceEvent of(Type type, ResourcePool pool, ResourceUsage usage,
                                   double totalUsage, Instant occurredAt) {
        return new ResourceEvent(type, pool.tenant(), pool.id(), usage, totalUsage,
            pool.thresholdIds(), occurredAt);
    }
}
