package com.rescontrol.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One caller's reservation against a pool.
 *
 * @param expiryTime instant after which the reservation is implicitly freed; null means it
 *                   never expires and must be released explicitly
 */
public record ResourceUsage(
    @JsonProperty("tenant") String tenant,
    @JsonProperty("id") String id,
    @JsonProperty("expiry_time") Instant expiryTime,
    @JsonProperty("units") double units
) {

    public boolean isActiveAt(Instant time) {
        return expiryTime == null || expiryTime.isAfter(time);
    }

    public boolean expires() {
        return expiryTime != null;
    }
}
