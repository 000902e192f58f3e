package com.rescontrol.admission;

import com.rescontrol.contract.ActivationInterval;
import com.rescontrol.contract.ResourcePool;
import com.rescontrol.selection.BlockerPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code admission.*} namespace.
 */
@ConfigurationProperties(prefix = "admission")
public class AdmissionProperties {

    private Duration lockTimeout = Duration.ofSeconds(2);
    private BlockerPolicy blockerPolicy = BlockerPolicy.ALWAYS;
    private DuplicateUsagePolicy duplicateUsage = DuplicateUsagePolicy.REPLACE;
    private long sweepIntervalMs = 60_000;
    private Store store = new Store();
    private Observer observer = new Observer();
    private List<Pool> pools = new ArrayList<>();

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }

    public BlockerPolicy getBlockerPolicy() {
        return blockerPolicy;
    }

    public void setBlockerPolicy(BlockerPolicy blockerPolicy) {
        this.blockerPolicy = blockerPolicy;
    }

    public DuplicateUsagePolicy getDuplicateUsage() {
        return duplicateUsage;
    }

    public void setDuplicateUsage(DuplicateUsagePolicy duplicateUsage) {
        this.duplicateUsage = duplicateUsage;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Observer getObserver() {
        return observer;
    }

    public void setObserver(Observer observer) {
        this.observer = observer;
    }

    public List<Pool> getPools() {
        return pools;
    }

    public void setPools(List<Pool> pools) {
        this.pools = pools;
    }

    public static class Store {

        /** {@code memory} or {@code file}. */
        private String type = "memory";
        private String path = "data/resources";
        /** Zero or negative saves synchronously under the pool lock. */
        private Duration interval = Duration.ofMillis(-1);
        private long backupIntervalMs = 5_000;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public long getBackupIntervalMs() {
            return backupIntervalMs;
        }

        public void setBackupIntervalMs(long backupIntervalMs) {
            this.backupIntervalMs = backupIntervalMs;
        }

        public boolean isDeferred() {
            return interval != null && !interval.isNegative() && !interval.isZero();
        }
    }

    public static class Observer {

        private int queueCapacity = 1024;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    /**
     * Pool definition as written in configuration. Limit defaults to unlimited.
     */
    public static class Pool {

        private String tenant;
        private String id;
        private List<String> filterIds = new ArrayList<>();
        private Instant activationTime;
        private Instant expiryTime;
        private Duration usageTtl;
        private double limit = ResourcePool.UNLIMITED;
        private String allocationMessage;
        private boolean blocker;
        private boolean stored;
        private double weight;
        private List<String> thresholdIds = new ArrayList<>();

        public ResourcePool toResourcePool() {
            ActivationInterval interval = activationTime == null && expiryTime == null
                ? null
                : new ActivationInterval(activationTime, expiryTime);
            return new ResourcePool(tenant, id, filterIds, interval, usageTtl, limit,
                allocationMessage, blocker, stored, weight, thresholdIds);
        }

        public String getTenant() {
            return tenant;
        }

        public void setTenant(String tenant) {
            this.tenant = tenant;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public List<String> getFilterIds() {
            return filterIds;
        }

        public void setFilterIds(List<String> filterIds) {
            this.filterIds = filterIds;
        }

        public Instant getActivationTime() {
            return activationTime;
        }

        public void setActivationTime(Instant activationTime) {
            this.activationTime = activationTime;
        }

        public Instant getExpiryTime() {
            return expiryTime;
        }

        public void setExpiryTime(Instant expiryTime) {
            this.expiryTime = expiryTime;
        }

        public Duration getUsageTtl() {
            return usageTtl;
        }

        public void setUsageTtl(Duration usageTtl) {
            this.usageTtl = usageTtl;
        }

        public double getLimit() {
            return limit;
        }

        public void setLimit(double limit) {
            this.limit = limit;
        }

        public String getAllocationMessage() {
            return allocationMessage;
        }

        public void setAllocationMessage(String allocationMessage) {
            this.allocationMessage = allocationMessage;
        }

        public boolean isBlocker() {
            return blocker;
        }

        public void setBlocker(boolean blocker) {
            this.blocker = blocker;
        }

        public boolean isStored() {
            return stored;
        }

        public void setStored(boolean stored) {
            this.stored = stored;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }

        public List<String> getThresholdIds() {
            return thresholdIds;
        }

        public void setThresholdIds(List<String> thresholdIds) {
            this.thresholdIds = thresholdIds;
        }
    }
}
