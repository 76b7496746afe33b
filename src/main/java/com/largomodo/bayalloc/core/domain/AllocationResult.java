package com.largomodo.bayalloc.core.domain;

import com.largomodo.bayalloc.core.SlotUsage;

import java.util.List;

/**
 * Outcome of one allocation pass.
 *
 * @param allocations       assignments, in the order they were made
 * @param overflows         overflow log, in the order it was recorded
 * @param usage             final slot usage table of the pass
 * @param consideredEvents  events kept after ordering and the cap
 * @param droppedByCap      events beyond the cap, never processed
 * @param alreadyServed     events absorbed because their (article, bay) was already assigned
 * @param unroutable        events whose location did not resolve to a known bay
 */
public record AllocationResult(List<AllocationRecord> allocations, List<OverflowRecord> overflows,
                               SlotUsage usage, int consideredEvents, int droppedByCap,
                               int alreadyServed, int unroutable) {

    public AllocationResult {
        allocations = List.copyOf(allocations);
        overflows = List.copyOf(overflows);
    }
}
