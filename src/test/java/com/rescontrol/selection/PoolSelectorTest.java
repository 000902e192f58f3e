package com.rescontrol.selection;

import com.rescontrol.contract.ActivationInterval;
import com.rescontrol.contract.EventAttributes;
import com.rescontrol.contract.NotFoundException;
import com.rescontrol.contract.ResourcePool;
import com.rescontrol.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PoolSelectorTest {

    private static final String TENANT = "cgrates.org";
    private static final EventAttributes ACCOUNT_1002 = EventAttributes.of(Map.of("Account", "1002"));

    private MutableClock clock;
    private InMemoryPoolCatalog catalog;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        catalog = new InMemoryPoolCatalog();
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        void highestWeightFirst() {
            catalog.put(pool("low").weight(5).build());
            catalog.put(pool("high").weight(20).build());
            catalog.put(pool("mid").weight(10).build());

            assertEquals(List.of("high", "mid", "low"), ids(selector(BlockerPolicy.ALWAYS).select(TENANT, ACCOUNT_1002, null)));
        }

        @Test
        void equalWeights_keepCatalogOrder() {
            catalog.put(pool("b").weight(10).build());
            catalog.put(pool("a").weight(10).build());
            catalog.put(pool("c").weight(10).build());

            assertEquals(List.of("b", "a", "c"), ids(selector(BlockerPolicy.ALWAYS).select(TENANT, ACCOUNT_1002, null)));
        }
    }

    @Nested
    @DisplayName("Filtering")
    class Filtering {

        @Test
        void nonMatchingPoolsAreDropped() {
            catalog.put(pool("ResGroup1").filterIds("*string:~*req.Account:1001;1002;1003").weight(10).build());
            catalog.put(pool("Other").filterIds("*string:~*req.Account:2000").weight(20).build());

            assertEquals(List.of("ResGroup1"), ids(selector(BlockerPolicy.ALWAYS).select(TENANT, ACCOUNT_1002, null)));
        }

        @Test
        void filterError_makesOnlyThatPoolNonMatching() {
            catalog.put(pool("Broken").filterIds("*regex:~*req.Account:.*").weight(20).build());
            catalog.put(pool("Plain").weight(10).build());

            assertEquals(List.of("Plain"), ids(selector(BlockerPolicy.ALWAYS).select(TENANT, ACCOUNT_1002, null)));
        }

        @Test
        void noMatch_isNotFound() {
            catalog.put(pool("Other").filterIds("*string:~*req.Account:2000").build());

            NotFoundException ex = assertThrows(NotFoundException.class,
                () -> selector(BlockerPolicy.ALWAYS).select(TENANT, ACCOUNT_1002, null));
            assertTrue(ex.getMessage().contains(TENANT));
        }

        @Test
        void unknownTenant_isNotFound() {
            catalog.put(pool("Plain").build());
            assertThrows(NotFoundException.class,
                () -> selector(BlockerPolicy.ALWAYS).select("unknown.org", ACCOUNT_1002, null));
        }
    }

    @Nested
    @DisplayName("Activation window")
    class Activation {

        @Test
        void poolOutsideWindowIsSkipped() {
            catalog.put(pool("Future")
                .activationInterval(new ActivationInterval(Instant.parse("2026-04-01T00:00:00Z"), null))
                .weight(20).build());
            catalog.put(pool("Expired")
                .activationInterval(new ActivationInterval(null, Instant.parse("2026-03-01T10:00:00Z")))
                .weight(15).build());
            catalog.put(pool("Always").weight(10).build());

            assertEquals(List.of("Always"), ids(selector(BlockerPolicy.ALWAYS).select(TENANT, ACCOUNT_1002, null)));
        }

        @Test
        void declaredEventTimeWinsOverClock() {
            catalog.put(pool("Future")
                .activationInterval(new ActivationInterval(Instant.parse("2026-04-01T00:00:00Z"), null))
                .build());

            List<ResourcePool> pools = selector(BlockerPolicy.ALWAYS)
                .select(TENANT, ACCOUNT_1002, Instant.parse("2026-04-02T00:00:00Z"));
            assertEquals(List.of("Future"), ids(pools));
        }

        @Test
        void clockDecidesWithoutEventTime() {
            catalog.put(pool("Future")
                .activationInterval(new ActivationInterval(Instant.parse("2026-04-01T00:00:00Z"), null))
                .build());
            PoolSelector selector = selector(BlockerPolicy.ALWAYS);

            assertThrows(NotFoundException.class, () -> selector.select(TENANT, ACCOUNT_1002, null));
            clock.set(Instant.parse("2026-04-01T00:00:00Z"));
            assertEquals(List.of("Future"), ids(selector.select(TENANT, ACCOUNT_1002, null)));
        }
    }

    @Nested
    @DisplayName("Blocker pools")
    class Blockers {

        @Test
        void matchedBlocker_endsWalkAfterIncludingItself() {
            catalog.put(pool("Blocker").blocker(true).weight(20).build());
            catalog.put(pool("Next").weight(10).build());

            assertEquals(List.of("Blocker"), ids(selector(BlockerPolicy.MATCHED_ONLY).select(TENANT, ACCOUNT_1002, null)));
            assertEquals(List.of("Blocker"), ids(selector(BlockerPolicy.ALWAYS).select(TENANT, ACCOUNT_1002, null)));
        }

        @Test
        void unmatchedBlocker_endsWalkOnlyUnderAlways() {
            catalog.put(pool("First").weight(30).build());
            catalog.put(pool("Blocker").filterIds("*string:~*req.Account:2000").blocker(true).weight(20).build());
            catalog.put(pool("Next").weight(10).build());

            assertEquals(List.of("First"), ids(selector(BlockerPolicy.ALWAYS).select(TENANT, ACCOUNT_1002, null)));
            assertEquals(List.of("First", "Next"),
                ids(selector(BlockerPolicy.MATCHED_ONLY).select(TENANT, ACCOUNT_1002, null)));
        }
    }

    @Test
    void catalogUpdates_areVisibleToLaterSelections() {
        catalog.put(pool("A").weight(10).build());
        catalog.put(pool("B").weight(5).build());
        PoolSelector selector = selector(BlockerPolicy.ALWAYS);
        assertEquals(List.of("A", "B"), ids(selector.select(TENANT, ACCOUNT_1002, null)));

        catalog.remove(TENANT, "A");
        assertEquals(List.of("B"), ids(selector.select(TENANT, ACCOUNT_1002, null)));
        assertTrue(catalog.getPool(TENANT, "A").isEmpty());
    }

    // ---- helpers ----

    private PoolSelector selector(BlockerPolicy policy) {
        return new PoolSelector(catalog, new InlineFilterEvaluator(), policy, clock);
    }

    private static ResourcePool.Builder pool(String id) {
        return ResourcePool.builder(TENANT, id);
    }

    private static List<String> ids(List<ResourcePool> pools) {
        return pools.stream().map(ResourcePool::id).toList();
    }
}
