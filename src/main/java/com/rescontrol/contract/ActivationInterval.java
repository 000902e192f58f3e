package com.rescontrol.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Half-open window {@code [activationTime, expiryTime)} during which a pool is visible to matching.
 * Either bound may be null, meaning unbounded on that side.
 */
public record ActivationInterval(
    @JsonProperty("activation_time") Instant activationTime,
    @JsonProperty("expiry_time") Instant expiryTime
) {

    public boolean isActiveAt(Instant time) {
        if (activationTime != null && time.isBefore(activationTime)) {
            return false;
        }
        return expiryTime == null || time.isBefore(expiryTime);
    }
}
