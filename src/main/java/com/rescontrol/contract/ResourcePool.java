package com.rescontrol.contract;

import java.time.Duration;
import java.util.List;

/**
 * Capacity configuration that events are matched against. Read-only to the admission core.
 *
 * @param filterIds          filter references, all of which must pass; empty means always matches
 * @param activationInterval optional visibility window, null means always active
 * @param usageTtl           auto-expiry applied to new usages; null, zero or negative means no expiry,
 *                           and a negative TTL also marks the pool unlimited
 * @param limit              capacity in units, {@link #UNLIMITED} disables the capacity check
 * @param allocationMessage  returned to the caller when this pool grants a reservation
 * @param blocker            ends the candidate walk, see {@code BlockerPolicy}
 * @param stored             live state survives a restart
 * @param weight             candidates are tried highest weight first
 * @param thresholdIds       observer targets, {@code ["*none"]} disables notifications
 */
public record ResourcePool(
    String tenant,
    String id,
    List<String> filterIds,
    ActivationInterval activationInterval,
    Duration usageTtl,
    double limit,
    String allocationMessage,
    boolean blocker,
    boolean stored,
    double weight,
    List<String> thresholdIds
) {

    public static final double UNLIMITED = -1;
    public static final String META_NONE = "*none";

    public ResourcePool {
        if (tenant == null || tenant.isBlank()) {
            throw new IllegalArgumentException("pool tenant is required");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("pool id is required");
        }
        filterIds = filterIds == null ? List.of() : List.copyOf(filterIds);
        thresholdIds = thresholdIds == null ? List.of() : List.copyOf(thresholdIds);
    }

    /**
     * True when either {@code limit} or {@code usageTtl} carries the unlimited marker. Usages are
     * still tracked, only the capacity check is skipped.
     */
    public boolean isUnlimited() {
        return limit == UNLIMITED || (usageTtl != null && usageTtl.isNegative());
    }

    /** Allocation message, falling back to the pool ID when none is configured. */
    public String effectiveAllocationMessage() {
        return allocationMessage == null || allocationMessage.isEmpty() ? id : allocationMessage;
    }

    public boolean notificationsDisabled() {
        return thresholdIds.size() == 1 && META_NONE.equals(thresholdIds.get(0));
    }

    public String tenantId() {
        return tenant + ":" + id;
    }

    public static Builder builder(String tenant, String id) {
        return new Builder(tenant, id);
    }

    public static final class Builder {

        private final String tenant;
        private final String id;
        private List<String> filterIds = List.of();
        private ActivationInterval activationInterval;
        private Duration usageTtl;
        private double limit = UNLIMITED;
        private String allocationMessage;
        private boolean blocker;
        private boolean stored;
        private double weight;
        private List<String> thresholdIds = List.of();

        private Builder(String tenant, String id) {
            this.tenant = tenant;
            this.id = id;
        }

        public Builder filterIds(String... filterIds) {
            this.filterIds = List.of(filterIds);
            return this;
        }

        public Builder filterIds(List<String> filterIds) {
            this.filterIds = filterIds;
            return this;
        }

        public Builder activationInterval(ActivationInterval activationInterval) {
            this.activationInterval = activationInterval;
            return this;
        }

        public Builder usageTtl(Duration usageTtl) {
            this.usageTtl = usageTtl;
            return this;
        }

        public Builder limit(double limit) {
            this.limit = limit;
            return this;
        }

        public Builder allocationMessage(String allocationMessage) {
            this.allocationMessage = allocationMessage;
            return this;
        }

        public Builder blocker(boolean blocker) {
            this.blocker = blocker;
            return this;
        }

        public Builder stored(boolean stored) {
            this.stored = stored;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder thresholdIds(List<String> thresholdIds) {
            this.thresholdIds = thresholdIds;
            return this;
        }

        public ResourcePool build() {
            return new ResourcePool(tenant, id, filterIds, activationInterval, usageTtl, limit,
                allocationMessage, blocker, stored, weight, thresholdIds);
        }
    }
}
