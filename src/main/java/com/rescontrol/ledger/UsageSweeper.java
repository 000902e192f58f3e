package com.rescontrol.ledger;

import com.rescontrol.lock.LockManager;
import com.rescontrol.lock.LockTimeoutException;
import com.rescontrol.selection.PoolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;

/**
 * Periodic expiry sweep over every pool in the ledger, bounding memory held by usages that
 * are never released nor touched again. Each pool is swept under its own lock.
 */
public class UsageSweeper {

    private static final Logger log = LoggerFactory.getLogger(UsageSweeper.class);

    private final UsageLedger ledger;
    private final LockManager lockManager;
    private final ResourceBackup backup;
    private final PoolCatalog catalog;
    private final Duration lockTimeout;
    private final Clock clock;

    public UsageSweeper(UsageLedger ledger, LockManager lockManager, ResourceBackup backup,
                        PoolCatalog catalog, Duration lockTimeout, Clock clock) {
        this.ledger = ledger;
        this.lockManager = lockManager;
        this.backup = backup;
        this.catalog = catalog;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
    }

    /**
     * @return total usages removed across all pools
     */
    @Scheduled(fixedDelayString = "${admission.sweep-interval-ms:60000}")
    public int sweep() {
        int total = 0;
        for (PoolState state : ledger.states()) {
            try {
                total += lockManager.withLock(LockManager.resourceKey(state.tenant(), state.id()), lockTimeout, () -> {
                    int removed = state.sweep(clock.instant());
                    if (removed > 0) {
                        catalog.getPool(state.tenant(), state.id())
                            .ifPresent(pool -> backup.record(pool, state));
                    }
                    return removed;
                });
            } catch (LockTimeoutException ex) {
                log.debug("Skipping sweep of {}:{} this round: {}", state.tenant(), state.id(), ex.getMessage());
            }
        }
        if (total > 0) {
            log.info("Background sweep removed {} expired usages", total);
        }
        return total;
    }
}
