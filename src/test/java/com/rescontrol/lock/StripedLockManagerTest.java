package com.rescontrol.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StripedLockManagerTest {

    private static final Duration TIMEOUT = Duration.ofMillis(200);

    private StripedLockManager lockManager;

    @BeforeEach
    void setUp() {
        lockManager = new StripedLockManager();
    }

    @Test
    @DisplayName("withLock returns the action's result and reuses one lock per key")
    void returnsResult() {
        assertEquals(42, lockManager.withLock("res:t:a", TIMEOUT, () -> 42));
        assertEquals(7, lockManager.withLock("res:t:a", TIMEOUT, () -> 7));
        assertEquals(1, lockManager.size());
    }

    @Test
    @DisplayName("runWithLock runs the action under the lock")
    void runWithLock() {
        AtomicInteger counter = new AtomicInteger();
        lockManager.runWithLock("res:t:a", TIMEOUT, counter::incrementAndGet);
        assertEquals(1, counter.get());
    }

    @Test
    @DisplayName("lock is reentrant for the holding thread")
    void reentrant() {
        String result = lockManager.withLock("res:t:a", TIMEOUT,
            () -> lockManager.withLock("res:t:a", TIMEOUT, () -> "inner"));
        assertEquals("inner", result);
    }

    @Test
    @DisplayName("lock is released when the action throws")
    void releasedOnException() {
        assertThrows(IllegalStateException.class, () -> lockManager.withLock("res:t:a", TIMEOUT, () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals("ok", lockManager.withLock("res:t:a", TIMEOUT, () -> "ok"));
    }

    @Test
    @DisplayName("waiting past the timeout raises LockTimeoutException without running the action")
    void timeout() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> lockManager.runWithLock("res:t:a", Duration.ofSeconds(5), () -> {
                held.countDown();
                awaitQuietly(done);
            }));
            assertTrue(held.await(5, TimeUnit.SECONDS));

            AtomicInteger ran = new AtomicInteger();
            LockTimeoutException ex = assertThrows(LockTimeoutException.class,
                () -> lockManager.withLock("res:t:a", Duration.ofMillis(50), ran::incrementAndGet));
            assertEquals("res:t:a", ex.getKey());
            assertEquals(0, ran.get());

            // other keys are unaffected
            assertEquals("free", lockManager.withLock("res:t:b", Duration.ofMillis(50), () -> "free"));

            done.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("concurrent increments under one key are serialized")
    void mutualExclusion() throws Exception {
        int threads = 8;
        int perThread = 500;
        int[] counter = {0};
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?>[] futures = new Future<?>[threads];
            for (int t = 0; t < threads; t++) {
                futures[t] = executor.submit(() -> {
                    awaitQuietly(start);
                    for (int i = 0; i < perThread; i++) {
                        lockManager.runWithLock("res:t:counter", Duration.ofSeconds(5), () -> counter[0]++);
                    }
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(threads * perThread, counter[0]);
    }

    @Test
    void resourceKey_combinesTenantAndPool() {
        assertEquals("res:cgrates.org:ResGroup1", LockManager.resourceKey("cgrates.org", "ResGroup1"));
    }

    // ---- helpers ----

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
