package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.AllocationRecord;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.OverflowRecord;

/**
 * Observer for per-event allocation outcomes.
 * <p>
 * Every considered event produces exactly one callback. All methods default to no-ops so
 * consumers override only what they report on. Observers must not influence allocation.
 *
 * @see FifoAllocationEngine
 */
public interface AllocationObserver {

    AllocationObserver NONE = new AllocationObserver() {
    };

    /**
     * Called when an event earned a slot.
     */
    default void onAllocated(DemandEvent event, AllocationRecord record) {}

    /**
     * Called when the event's bay had no slot of the required class left.
     */
    default void onOverflow(DemandEvent event, OverflowRecord record) {}

    /**
     * Called when the event's (article, bay) pair was already assigned.
     */
    default void onAlreadyServed(DemandEvent event) {}

    /**
     * Called when the event's location does not resolve to a known bay.
     */
    default void onUnroutable(DemandEvent event) {}
}
