package com.rescontrol.selection;

import com.rescontrol.contract.EventAttributes;
import com.rescontrol.contract.NotFoundException;
import com.rescontrol.contract.ResourcePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Resolves the ordered candidate pools for an event.
 *
 * Pools outside their activation window are dropped, the rest are walked highest weight first
 * (catalog order breaks ties) and kept when their filters pass. Blocker pools end the walk
 * according to the configured {@link BlockerPolicy}. A filter that cannot be evaluated makes
 * its pool non-matching.
 */
public class PoolSelector {

    private static final Logger log = LoggerFactory.getLogger(PoolSelector.class);

    private final PoolCatalog catalog;
    private final FilterEvaluator filterEvaluator;
    private final BlockerPolicy blockerPolicy;
    private final Clock clock;

    public PoolSelector(PoolCatalog catalog, FilterEvaluator filterEvaluator,
                        BlockerPolicy blockerPolicy, Clock clock) {
        this.catalog = catalog;
        this.filterEvaluator = filterEvaluator;
        this.blockerPolicy = blockerPolicy;
        this.clock = clock;
    }

    /**
     * @param eventTime declared time of the event, null means now
     * @throws NotFoundException if no pool survives
     */
    public List<ResourcePool> select(String tenant, EventAttributes event, Instant eventTime) {
        Instant at = eventTime != null ? eventTime : clock.instant();

        List<ResourcePool> candidates = new ArrayList<>();
        for (ResourcePool pool : catalog.getPools(tenant)) {
            if (pool.activationInterval() == null || pool.activationInterval().isActiveAt(at)) {
                candidates.add(pool);
            }
        }
        // List.sort is stable, catalog order survives among equal weights
        candidates.sort(Comparator.comparingDouble(ResourcePool::weight).reversed());

        List<ResourcePool> selected = new ArrayList<>();
        for (ResourcePool pool : candidates) {
            boolean matched = safeMatches(tenant, event, pool);
            if (matched) {
                selected.add(pool);
            }
            if (pool.blocker() && (matched || blockerPolicy == BlockerPolicy.ALWAYS)) {
                log.debug("Blocker pool {} (matched={}) ends candidate walk for tenant {}",
                    pool.id(), matched, tenant);
                break;
            }
        }

        if (selected.isEmpty()) {
            throw new NotFoundException("no resource pool matches the event for tenant: " + tenant);
        }
        return selected;
    }

    private boolean safeMatches(String tenant, EventAttributes event, ResourcePool pool) {
        if (pool.filterIds().isEmpty()) {
            return true;
        }
        try {
            return filterEvaluator.matches(tenant, event, pool.filterIds());
        } catch (RuntimeException ex) {
            log.warn("Filter evaluation failed for pool {}, treating it as non-matching: {}",
                pool.tenantId(), ex.getMessage());
            return false;
        }
    }
}
