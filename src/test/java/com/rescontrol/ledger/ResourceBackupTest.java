package com.rescontrol.ledger;

import com.rescontrol.contract.Resource;
import com.rescontrol.contract.ResourcePool;
import com.rescontrol.contract.ResourceUsage;
import com.rescontrol.lock.StripedLockManager;
import com.rescontrol.store.InMemoryResourceStore;
import com.rescontrol.store.ResourceStore;
import com.rescontrol.store.ResourceStoreException;
import com.rescontrol.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ResourceBackupTest {

    private static final ResourcePool STORED = ResourcePool.builder("cgrates.org", "Stored").stored(true).build();
    private static final ResourcePool EPHEMERAL = ResourcePool.builder("cgrates.org", "Ephemeral").build();

    private MutableClock clock;
    private InMemoryResourceStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        store = new InMemoryResourceStore();
    }

    @Test
    @DisplayName("synchronous mode saves stored pools immediately and ignores ephemeral ones")
    void synchronousSave() {
        UsageLedger ledger = new UsageLedger(store, clock);
        ResourceBackup backup = backup(store, ledger, false);

        PoolState stored = ledger.stateFor(STORED);
        stored.record(new ResourceUsage("cgrates.org", "u1", null, 2));
        backup.record(STORED, stored);

        PoolState ephemeral = ledger.stateFor(EPHEMERAL);
        ephemeral.record(new ResourceUsage("cgrates.org", "u1", null, 2));
        backup.record(EPHEMERAL, ephemeral);

        assertEquals(1, store.size());
        assertEquals(2.0, store.load("cgrates.org", "Stored").orElseThrow().totalUsage());
        assertEquals(0, backup.dirtyCount());
    }

    @Test
    @DisplayName("deferred mode marks pools dirty and writes them on flush")
    void deferredFlush() {
        UsageLedger ledger = new UsageLedger(store, clock);
        ResourceBackup backup = backup(store, ledger, true);

        PoolState state = ledger.stateFor(STORED);
        state.record(new ResourceUsage("cgrates.org", "u1", null, 1));
        backup.record(STORED, state);
        state.record(new ResourceUsage("cgrates.org", "u2", null, 1));
        backup.record(STORED, state);

        assertEquals(1, backup.dirtyCount());
        assertTrue(store.load("cgrates.org", "Stored").isEmpty());

        backup.flush();
        assertEquals(0, backup.dirtyCount());
        assertEquals(2, store.load("cgrates.org", "Stored").orElseThrow().usages().size());
    }

    @Test
    @DisplayName("shutdown flushes pending pools")
    void shutdownFlushes() {
        UsageLedger ledger = new UsageLedger(store, clock);
        ResourceBackup backup = backup(store, ledger, true);

        PoolState state = ledger.stateFor(STORED);
        state.record(new ResourceUsage("cgrates.org", "u1", null, 1));
        backup.record(STORED, state);
        backup.shutdown();

        assertTrue(store.load("cgrates.org", "Stored").isPresent());
    }

    @Test
    @DisplayName("a failed write is logged, kept dirty and retried on the next flush")
    void failedWriteIsRetried() {
        AtomicBoolean failing = new AtomicBoolean(true);
        ResourceStore flaky = new ResourceStore() {
            @Override
            public Optional<Resource> load(String tenant, String id) {
                return store.load(tenant, id);
            }

            @Override
            public void save(Resource resource) {
                if (failing.get()) {
                    throw new ResourceStoreException("disk full", null);
                }
                store.save(resource);
            }
        };
        UsageLedger ledger = new UsageLedger(flaky, clock);
        ResourceBackup backup = backup(flaky, ledger, true);

        PoolState state = ledger.stateFor(STORED);
        state.record(new ResourceUsage("cgrates.org", "u1", null, 1));
        backup.record(STORED, state);

        assertDoesNotThrow(backup::flush);
        assertEquals(1, backup.dirtyCount());

        failing.set(false);
        backup.flush();
        assertEquals(0, backup.dirtyCount());
        assertTrue(store.load("cgrates.org", "Stored").isPresent());
    }

    @Test
    @DisplayName("synchronous write failures do not propagate to the caller")
    void synchronousFailureSwallowedWithWarning() {
        ResourceStore broken = new ResourceStore() {
            @Override
            public Optional<Resource> load(String tenant, String id) {
                return Optional.empty();
            }

            @Override
            public void save(Resource resource) {
                throw new ResourceStoreException("read-only file system", null);
            }
        };
        UsageLedger ledger = new UsageLedger(broken, clock);
        ResourceBackup backup = backup(broken, ledger, false);

        PoolState state = ledger.stateFor(STORED);
        state.record(new ResourceUsage("cgrates.org", "u1", null, 1));
        assertDoesNotThrow(() -> backup.record(STORED, state));
        assertEquals(1.0, state.totalUsage());
    }

    // ---- helpers ----

    private ResourceBackup backup(ResourceStore target, UsageLedger ledger, boolean deferred) {
        return new ResourceBackup(target, ledger, new StripedLockManager(), Duration.ofMillis(200), deferred, clock);
    }
}
