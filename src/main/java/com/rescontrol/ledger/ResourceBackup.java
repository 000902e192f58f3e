package com.rescontrol.ledger;

import com.rescontrol.contract.Resource;
import com.rescontrol.contract.ResourcePool;
import com.rescontrol.lock.LockManager;
import com.rescontrol.lock.LockTimeoutException;
import com.rescontrol.store.ResourceStore;
import com.rescontrol.store.ResourceStoreException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes the state of {@code Stored} pools to the {@link ResourceStore}.
 *
 * In synchronous mode {@link #record} saves immediately (the caller holds the pool lock).
 * In deferred mode it only marks the pool dirty and {@link #flush} saves dirty pools
 * periodically and on shutdown. Write failures are logged, never propagated: the in-memory
 * state stays authoritative and the pool is retried on the next flush.
 */
public class ResourceBackup {

    private static final Logger log = LoggerFactory.getLogger(ResourceBackup.class);

    private final ResourceStore store;
    private final UsageLedger ledger;
    private final LockManager lockManager;
    private final Duration lockTimeout;
    private final boolean deferred;
    private final Clock clock;
    private final ConcurrentHashMap<String, ResourcePool> dirty = new ConcurrentHashMap<>();

    public ResourceBackup(ResourceStore store, UsageLedger ledger, LockManager lockManager,
                          Duration lockTimeout, boolean deferred, Clock clock) {
        this.store = store;
        this.ledger = ledger;
        this.lockManager = lockManager;
        this.lockTimeout = lockTimeout;
        this.deferred = deferred;
        this.clock = clock;
    }

    /**
     * Called with the pool lock held after {@code state} changed. No-op for ephemeral pools.
     */
    public void record(ResourcePool pool, PoolState state) {
        if (!pool.stored()) {
            return;
        }
        if (deferred) {
            dirty.put(pool.tenantId(), pool);
            return;
        }
        save(state.snapshot(clock.instant()));
    }

    @Scheduled(fixedDelayString = "${admission.store.backup-interval-ms:5000}")
    public void flush() {
        if (dirty.isEmpty()) {
            return;
        }
        List<ResourcePool> failed = new ArrayList<>();
        Iterator<Map.Entry<String, ResourcePool>> it = dirty.entrySet().iterator();
        while (it.hasNext()) {
            ResourcePool pool = it.next().getValue();
            it.remove();
            boolean saved;
            try {
                saved = lockManager.withLock(LockManager.resourceKey(pool.tenant(), pool.id()), lockTimeout,
                    () -> ledger.existing(pool.tenant(), pool.id())
                        .map(state -> save(state.snapshot(clock.instant())))
                        .orElse(true));
            } catch (LockTimeoutException ex) {
                log.warn("Backup of resource {} postponed: {}", pool.tenantId(), ex.getMessage());
                saved = false;
            }
            if (!saved) {
                failed.add(pool);
            }
        }
        failed.forEach(pool -> dirty.putIfAbsent(pool.tenantId(), pool));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Flushing {} dirty resources before shutdown", dirty.size());
        flush();
    }

    public int dirtyCount() {
        return dirty.size();
    }

    private boolean save(Resource resource) {
        try {
            store.save(resource);
            return true;
        } catch (ResourceStoreException ex) {
            log.warn("Failed saving resource {}, in-memory state stays authoritative: {}",
                resource.tenantId(), ex.getMessage());
            return false;
        }
    }
}
