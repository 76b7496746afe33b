package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.AllocationRecord;
import com.largomodo.bayalloc.core.domain.AllocationResult;
import com.largomodo.bayalloc.core.domain.ArticleBayKey;
import com.largomodo.bayalloc.core.domain.Bay;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.Location;
import com.largomodo.bayalloc.core.domain.LocationMapping;
import com.largomodo.bayalloc.core.domain.OverflowRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * First-come-first-served slot allocation by recency.
 * <p>
 * Single greedy pass without backtracking: the most recent demand for a bay and size class gets
 * the slot, later (older) demand overflows once the class is exhausted. There is no optimization
 * objective; this mirrors how a warehouse hands slots to its freshest demand.
 * <p>
 * The slot class is the pick location's class, never derived from article dimensions.
 */
public class FifoAllocationEngine implements AllocationEngine {

    private static final Logger log = LoggerFactory.getLogger(FifoAllocationEngine.class);

    private final AllocationObserver observer;

    public FifoAllocationEngine() {
        this(AllocationObserver.NONE);
    }

    public FifoAllocationEngine(AllocationObserver observer) {
        if (observer == null) {
            throw new IllegalArgumentException("Observer cannot be null");
        }
        this.observer = observer;
    }

    @Override
    public AllocationResult allocate(List<DemandEvent> demandEvents, LocationMapping mapping,
                                     Map<String, Bay> bays, int maxEvents) {
        if (demandEvents == null || mapping == null || bays == null) {
            throw new IllegalArgumentException("Demand events, mapping and bays cannot be null");
        }

        List<DemandEvent> considered = DemandOrdering.mostRecentFirst(demandEvents, maxEvents);
        int droppedByCap = demandEvents.size() - considered.size();
        if (droppedByCap > 0) {
            log.debug("Cap of {} events drops {} older events", maxEvents, droppedByCap);
        }

        SlotUsage usage = new SlotUsage();
        Set<ArticleBayKey> served = new HashSet<>();
        List<AllocationRecord> allocations = new ArrayList<>();
        List<OverflowRecord> overflows = new ArrayList<>();
        int alreadyServed = 0;
        int unroutable = 0;

        for (DemandEvent event : considered) {
            Optional<Location> resolved = mapping.resolve(event.locationCode());
            Bay bay = resolved.map(location -> bays.get(location.bayCode())).orElse(null);
            if (bay == null) {
                // Never had a valid bay to target: not overflow
                unroutable++;
                observer.onUnroutable(event);
                continue;
            }

            Location location = resolved.get();
            SizeClass sizeClass = location.sizeClass();
            ArticleBayKey key = new ArticleBayKey(event.article(), bay.code());

            if (served.contains(key)) {
                alreadyServed++;
                observer.onAlreadyServed(event);
                continue;
            }

            // Invariant: used(bay, class) <= available(bay, class) after every step
            if (usage.used(bay.code(), sizeClass) < bay.available(sizeClass)) {
                AllocationRecord record = new AllocationRecord(event.article(), bay.code(), sizeClass,
                        location.code(), bay.provenance());
                allocations.add(record);
                usage.increment(bay.code(), sizeClass);
                served.add(key);
                observer.onAllocated(event, record);
            } else {
                OverflowRecord record = new OverflowRecord(event.article(), bay.code(), sizeClass,
                        location.code(), event.dateSource());
                overflows.add(record);
                observer.onOverflow(event, record);
            }
        }

        log.debug("Allocation pass: {} considered, {} allocated, {} overflow, {} already served, {} unroutable",
                considered.size(), allocations.size(), overflows.size(), alreadyServed, unroutable);

        return new AllocationResult(allocations, overflows, usage, considered.size(), droppedByCap,
                alreadyServed, unroutable);
    }
}
