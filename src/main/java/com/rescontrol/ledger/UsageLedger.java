package com.rescontrol.ledger;

import com.rescontrol.contract.ResourcePool;
import com.rescontrol.store.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of live pool states, owned by one admission engine.
 *
 * A state is created on first touch. For a {@code Stored} pool it is rebuilt from the
 * {@link ResourceStore} and swept right away, so stale reservations cannot come back after
 * a restart. Callers must hold the pool's lock around {@link #stateFor} and any use of the
 * returned state.
 */
public class UsageLedger {

    private static final Logger log = LoggerFactory.getLogger(UsageLedger.class);

    private final ConcurrentHashMap<String, PoolState> states = new ConcurrentHashMap<>();
    private final ResourceStore store;
    private final Clock clock;

    public UsageLedger(ResourceStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public PoolState stateFor(ResourcePool pool) {
        return states.computeIfAbsent(pool.tenantId(), key -> load(pool));
    }

    public Optional<PoolState> existing(String tenant, String id) {
        return Optional.ofNullable(states.get(tenant + ":" + id));
    }

    public List<PoolState> states() {
        return List.copyOf(states.values());
    }

    private PoolState load(ResourcePool pool) {
        if (!pool.stored()) {
            return new PoolState(pool.tenant(), pool.id());
        }
        PoolState state = store.load(pool.tenant(), pool.id())
            .map(PoolState::restore)
            .orElseGet(() -> new PoolState(pool.tenant(), pool.id()));
        int expired = state.sweep(clock.instant());
        log.info("Restored resource {} with {} live usages ({} expired while stored)",
            pool.tenantId(), state.snapshot(clock.instant()).usages().size(), expired);
        return state;
    }
}
