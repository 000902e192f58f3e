package com.rescontrol.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Arguments shared by every admission operation.
 *
 * @param units    requested quantity, null means 1
 * @param usageTtl per-request override of the pool's usage TTL, null or zero keeps the pool's
 * @param time     declared event time used for activation checks, null means now
 */
public record UsageRequest(
    @JsonProperty("tenant") String tenant,
    @JsonProperty("event_id") String eventId,
    @JsonProperty("event") EventAttributes event,
    @JsonProperty("usage_id") String usageId,
    @JsonProperty("units") Double units,
    @JsonProperty("usage_ttl") Duration usageTtl,
    @JsonProperty("time") Instant time
) {

    public static final double DEFAULT_UNITS = 1;

    public UsageRequest {
        if (event == null) {
            event = EventAttributes.empty();
        }
    }

    public static UsageRequest of(String tenant, EventAttributes event, String usageId, double units) {
        return new UsageRequest(tenant, null, event, usageId, units, null, null);
    }

    public static UsageRequest of(String tenant, EventAttributes event, String usageId) {
        return new UsageRequest(tenant, null, event, usageId, null, null, null);
    }

    public double effectiveUnits() {
        return units == null ? DEFAULT_UNITS : units;
    }

    public UsageRequest withUsageTtl(Duration ttl) {
        return new UsageRequest(tenant, eventId, event, usageId, units, ttl, time);
    }

    public UsageRequest withTime(Instant eventTime) {
        return new UsageRequest(tenant, eventId, event, usageId, units, usageTtl, eventTime);
    }
}
