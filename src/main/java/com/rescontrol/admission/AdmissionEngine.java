package com.rescontrol.admission;

import com.rescontrol.contract.NotFoundException;
import com.rescontrol.contract.Resource;
import com.rescontrol.contract.ResourcePool;
import com.rescontrol.contract.ResourceUsage;
import com.rescontrol.contract.UsageRequest;
import com.rescontrol.contract.UsageRequestValidator;
import com.rescontrol.ledger.PoolState;
import com.rescontrol.ledger.ResourceBackup;
import com.rescontrol.ledger.UsageLedger;
import com.rescontrol.lock.LockManager;
import com.rescontrol.observer.ObserverHook;
import com.rescontrol.observer.ResourceEvent;
import com.rescontrol.selection.PoolCatalog;
import com.rescontrol.selection.PoolSelector;
import com.rescontrol.store.ResourceStoreException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Arbitrates pool capacity for usage requests.
 *
 * Candidate pools are tried one at a time in selector order; each pool is locked, swept,
 * checked and unlocked on its own. The first pool with room wins. A failed authorize or
 * allocate leaves every pool untouched. Release is the only operation holding several pool
 * locks at once, always taken in key order.
 */
@Service
public class AdmissionEngine {

    private static final Logger log = LoggerFactory.getLogger(AdmissionEngine.class);

    private final PoolSelector selector;
    private final PoolCatalog catalog;
    private final UsageLedger ledger;
    private final LockManager lockManager;
    private final ResourceBackup backup;
    private final ObserverHook observer;
    private final UsageRequestValidator validator;
    private final Duration lockTimeout;
    private final DuplicateUsagePolicy duplicatePolicy;
    private final Clock clock;

    public AdmissionEngine(PoolSelector selector,
                           PoolCatalog catalog,
                           UsageLedger ledger,
                           LockManager lockManager,
                           ResourceBackup backup,
                           ObserverHook observer,
                           UsageRequestValidator validator,
                           AdmissionProperties properties,
                           Clock clock) {
        this.selector = selector;
        this.catalog = catalog;
        this.ledger = ledger;
        this.lockManager = lockManager;
        this.backup = backup;
        this.observer = observer;
        this.validator = validator;
        this.lockTimeout = properties.getLockTimeout();
        this.duplicatePolicy = properties.getDuplicateUsage();
        this.clock = clock;
    }

    @PostConstruct
    void restoreOnStartup() {
        restoreStoredResources();
    }

    /**
     * Loads the persisted state of every {@code Stored} pool in the catalog. A pool whose state
     * cannot be read is skipped and loaded again on its next request.
     *
     * @return number of pools restored
     */
    public int restoreStoredResources() {
        int restored = 0;
        for (String tenant : catalog.tenants()) {
            for (ResourcePool pool : catalog.getPools(tenant)) {
                if (!pool.stored()) {
                    continue;
                }
                try {
                    lockManager.withLock(lockKey(pool), lockTimeout, () -> ledger.stateFor(pool));
                    restored++;
                } catch (ResourceStoreException ex) {
                    log.error("Could not restore resource {}, retrying on first use: {}",
                        pool.tenantId(), ex.getMessage());
                }
            }
        }
        if (restored > 0) {
            log.info("Restored {} stored resources", restored);
        }
        return restored;
    }

    /**
     * Live state of every pool matching the event, without reserving anything.
     */
    public List<Resource> getResourcesForEvent(UsageRequest request) {
        validator.validate(request, false);
        List<ResourcePool> pools = selector.select(request.tenant(), request.event(), request.time());
        List<Resource> resources = new ArrayList<>(pools.size());
        for (ResourcePool pool : pools) {
            resources.add(lockManager.withLock(lockKey(pool), lockTimeout,
                () -> ledger.stateFor(pool).snapshot(clock.instant())));
        }
        return resources;
    }

    public Resource getResource(String tenant, String id) {
        ResourcePool pool = catalog.getPool(tenant, id)
            .orElseThrow(() -> new NotFoundException("resource pool not found: " + tenant + ":" + id));
        return lockManager.withLock(lockKey(pool), lockTimeout,
            () -> ledger.stateFor(pool).snapshot(clock.instant()));
    }

    /**
     * Dry run of {@link #allocate}.
     *
     * @return allocation message of the first pool that could take the usage
     * @throws ResourceUnauthorizedException if none could
     */
    public String authorize(UsageRequest request) {
        validator.validate(request, true);
        List<ResourcePool> pools = selector.select(request.tenant(), request.event(), request.time());
        return walk(request, pools, false)
            .map(grant -> grant.pool().effectiveAllocationMessage())
            .orElseThrow(() -> new ResourceUnauthorizedException(request.usageId()));
    }

    /**
     * Records the usage in the first matching pool with room for it.
     *
     * @return allocation message of the granting pool
     * @throws ResourceUnavailableException if no pool had room
     */
    public String allocate(UsageRequest request) {
        validator.validate(request, true);
        List<ResourcePool> pools = selector.select(request.tenant(), request.event(), request.time());
        Grant grant = walk(request, pools, true)
            .orElseThrow(() -> new ResourceUnavailableException(request.usageId()));
        log.info("Allocated usage {} ({} units) on {}", request.usageId(), grant.usage().units(),
            grant.pool().tenantId());
        fire(ResourceEvent.Type.ALLOCATED, grant.pool(), grant.usage(), grant.totalUsage());
        return grant.pool().effectiveAllocationMessage();
    }

    /**
     * Removes the usage from every matching pool that holds it.
     *
     * All matching pools are locked together, in key order, before anything is removed, so a
     * lock timeout leaves every pool untouched.
     *
     * @throws NotFoundException if no matching pool holds a live usage with that ID
     */
    public void release(UsageRequest request) {
        validator.validate(request, true);
        List<ResourcePool> pools = selector.select(request.tenant(), request.event(), request.time());
        List<Grant> released = withAllLocks(pools, () -> {
            Instant now = clock.instant();
            List<Grant> removed = new ArrayList<>();
            for (ResourcePool pool : pools) {
                PoolState state = ledger.stateFor(pool);
                int swept = state.sweep(now);
                Optional<ResourceUsage> usage = state.clear(request.usageId());
                if (usage.isPresent() || swept > 0) {
                    backup.record(pool, state);
                }
                usage.ifPresent(u -> removed.add(new Grant(pool, u, state.totalUsage())));
            }
            return removed;
        });
        if (released.isEmpty()) {
            throw NotFoundException.usage(request.usageId());
        }
        for (Grant grant : released) {
            log.info("Released usage {} from {}", request.usageId(), grant.pool().tenantId());
            fire(ResourceEvent.Type.RELEASED, grant.pool(), grant.usage(), grant.totalUsage());
        }
    }

    private Optional<Grant> walk(UsageRequest request, List<ResourcePool> pools, boolean commit) {
        for (ResourcePool pool : pools) {
            Grant grant = lockManager.withLock(lockKey(pool), lockTimeout, () -> tryPool(pool, request, commit));
            if (grant != null) {
                return Optional.of(grant);
            }
            log.debug("Pool {} cannot take {} units for usage {}", pool.tenantId(),
                request.effectiveUnits(), request.usageId());
        }
        return Optional.empty();
    }

    /**
     * Must run under the pool lock. Returns null when the pool has no room.
     */
    private Grant tryPool(ResourcePool pool, UsageRequest request, boolean commit) {
        PoolState state = ledger.stateFor(pool);
        Instant now = clock.instant();
        int swept = state.sweep(now);

        Optional<ResourceUsage> existing = state.usage(request.usageId());
        if (existing.isPresent() && duplicatePolicy == DuplicateUsagePolicy.REJECT) {
            persistSweep(pool, state, swept);
            throw new DuplicateUsageException(request.tenant(), request.usageId());
        }

        double units = request.effectiveUnits();
        double used = state.totalUsage() - existing.map(ResourceUsage::units).orElse(0.0);
        if (!pool.isUnlimited() && pool.limit() < used + units) {
            persistSweep(pool, state, swept);
            return null;
        }
        if (!commit) {
            persistSweep(pool, state, swept);
            return new Grant(pool, null, state.totalUsage());
        }

        ResourceUsage usage = new ResourceUsage(request.tenant(), request.usageId(),
            expiryTime(pool, request, now), units);
        state.record(usage);
        backup.record(pool, state);
        return new Grant(pool, usage, state.totalUsage());
    }

    private void persistSweep(ResourcePool pool, PoolState state, int swept) {
        if (swept > 0) {
            backup.record(pool, state);
        }
    }

    private static Instant expiryTime(ResourcePool pool, UsageRequest request, Instant now) {
        Duration ttl = request.usageTtl() != null && isPositive(request.usageTtl())
            ? request.usageTtl()
            : pool.usageTtl();
        return ttl != null && isPositive(ttl) ? now.plus(ttl) : null;
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }

    private void fire(ResourceEvent.Type type, ResourcePool pool, ResourceUsage usage, double totalUsage) {
        if (pool.notificationsDisabled()) {
            return;
        }
        try {
            observer.notify(ResourceEvent.of(type, pool, usage, totalUsage, clock.instant()));
        } catch (RuntimeException ex) {
            log.warn("Observer notification failed for {}: {}", pool.tenantId(), ex.getMessage());
        }
    }

    private <T> T withAllLocks(List<ResourcePool> pools, Supplier<T> action) {
        List<String> keys = pools.stream().map(AdmissionEngine::lockKey).distinct().sorted().toList();
        return withLocks(keys, 0, action);
    }

    private <T> T withLocks(List<String> keys, int index, Supplier<T> action) {
        if (index == keys.size()) {
            return action.get();
        }
        return lockManager.withLock(keys.get(index), lockTimeout, () -> withLocks(keys, index + 1, action));
    }

    private static String lockKey(ResourcePool pool) {
        return LockManager.resourceKey(pool.tenant(), pool.id());
    }

    private record Grant(ResourcePool pool, ResourceUsage usage, double totalUsage) {
    }
}
