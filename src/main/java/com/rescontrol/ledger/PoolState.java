package com.rescontrol.ledger;

import com.rescontrol.contract.Resource;
import com.rescontrol.contract.ResourceUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Live reservations of one pool. Not thread safe: every call must hold the pool's lock.
 *
 * Usages with an expiry time are also kept in a TTL index ordered by expiry, so a sweep only
 * touches the expired head of the index instead of scanning every usage.
 */
public final class PoolState {

    private static final Logger log = LoggerFactory.getLogger(PoolState.class);

    private static final Comparator<TtlEntry> TTL_ORDER =
        Comparator.comparing(TtlEntry::expiryTime).thenComparing(TtlEntry::usageId);

    private final String tenant;
    private final String id;
    private final Map<String, ResourceUsage> usages = new LinkedHashMap<>();
    private final NavigableSet<TtlEntry> ttlIdx = new TreeSet<>(TTL_ORDER);
    private double totalUsage;

    public PoolState(String tenant, String id) {
        this.tenant = tenant;
        this.id = id;
    }

    /**
     * Rebuilds state from a stored snapshot. Expired entries are kept until the next sweep.
     */
    public static PoolState restore(Resource resource) {
        PoolState state = new PoolState(resource.tenant(), resource.id());
        resource.usages().values().forEach(state::record);
        return state;
    }

    public String tenant() {
        return tenant;
    }

    public String id() {
        return id;
    }

    /**
     * Removes every usage whose expiry time is not after {@code now}.
     *
     * @return number of usages removed
     */
    public int sweep(Instant now) {
        int removed = 0;
        Iterator<TtlEntry> it = ttlIdx.iterator();
        while (it.hasNext()) {
            TtlEntry head = it.next();
            if (head.expiryTime().isAfter(now)) {
                break;
            }
            it.remove();
            ResourceUsage usage = usages.remove(head.usageId());
            if (usage != null) {
                subtract(usage.units());
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired usages from {}:{}", removed, tenant, id);
        }
        return removed;
    }

    public double totalUsage() {
        return totalUsage;
    }

    public Optional<ResourceUsage> usage(String usageId) {
        return Optional.ofNullable(usages.get(usageId));
    }

    public boolean isEmpty() {
        return usages.isEmpty();
    }

    /**
     * Inserts {@code usage}, replacing any entry with the same ID.
     */
    public void record(ResourceUsage usage) {
        clear(usage.id());
        usages.put(usage.id(), usage);
        totalUsage += usage.units();
        if (usage.expires()) {
            ttlIdx.add(new TtlEntry(usage.expiryTime(), usage.id()));
        }
    }

    public Optional<ResourceUsage> clear(String usageId) {
        ResourceUsage usage = usages.remove(usageId);
        if (usage == null) {
            return Optional.empty();
        }
        if (usage.expires()) {
            ttlIdx.remove(new TtlEntry(usage.expiryTime(), usageId));
        }
        subtract(usage.units());
        return Optional.of(usage);
    }

    /**
     * Copy of the usages still active at {@code now}; expired ones are left out even if not yet swept.
     */
    public Resource snapshot(Instant now) {
        Map<String, ResourceUsage> live = new LinkedHashMap<>();
        usages.forEach((usageId, usage) -> {
            if (usage.isActiveAt(now)) {
                live.put(usageId, usage);
            }
        });
        List<String> liveIdx = new ArrayList<>();
        for (TtlEntry entry : ttlIdx) {
            if (live.containsKey(entry.usageId())) {
                liveIdx.add(entry.usageId());
            }
        }
        return new Resource(tenant, id, live, liveIdx);
    }

    private void subtract(double units) {
        totalUsage -= units;
        if (totalUsage < 0) {
            log.warn("Total usage of {}:{} dropped below zero ({}), recomputing", tenant, id, totalUsage);
            totalUsage = usages.values().stream().mapToDouble(ResourceUsage::units).sum();
        }
    }

    private record TtlEntry(Instant expiryTime, String usageId) {
    }
}
