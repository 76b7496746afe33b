package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.AllocationResult;
import com.largomodo.bayalloc.core.domain.Bay;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.LocationMapping;

import java.util.List;
import java.util.Map;

/**
 * Strategy interface for assigning demand events to bay slots.
 * <p>
 * Implementations must never assign more slots of a size class to a bay than its inventory
 * holds, and must assign each (article, bay) pair at most once.
 */
public interface AllocationEngine {

    /**
     * Allocates slots for the given demand.
     *
     * @param demandEvents events in input order, must not be null
     * @param mapping      resolved raw location codes, must not be null
     * @param bays         bay inventories keyed by bay code, must not be null
     * @param maxEvents    number of events to consider after ordering, must be positive
     * @return assignments, overflow log and usage of the pass
     * @throws IllegalArgumentException if an argument is null or maxEvents is not positive
     */
    AllocationResult allocate(List<DemandEvent> demandEvents, LocationMapping mapping,
                              Map<String, Bay> bays, int maxEvents);
}
