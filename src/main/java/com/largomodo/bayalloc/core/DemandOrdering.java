package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.DemandEvent;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recency ordering of demand events.
 * <p>
 * Most recent derived date first; events without a parseable date sort after every dated event.
 * Equal dates keep their relative input order, which makes repeated runs over identical input
 * produce identical output. Applying the selection to an already selected list returns it unchanged.
 */
public final class DemandOrdering {

    private DemandOrdering() {
    }

    /**
     * Sorts by recency and keeps the first {@code maxEvents} events.
     *
     * @param events    events in input order, must not be null
     * @param maxEvents hard cap, must be positive
     * @return new list of at most {@code maxEvents} events, most recent first
     * @throws IllegalArgumentException if events is null or maxEvents is not positive
     */
    public static List<DemandEvent> mostRecentFirst(List<DemandEvent> events, int maxEvents) {
        if (events == null) {
            throw new IllegalArgumentException("Demand events cannot be null");
        }
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("maxEvents must be positive, got: " + maxEvents);
        }

        // Derive each date once; the comparator runs O(n log n) times
        List<Keyed> keyed = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            DemandEvent event = events.get(i);
            keyed.add(new Keyed(event, event.derivedDate(), i));
        }
        keyed.sort(Comparator.comparing(Keyed::date, Comparator.reverseOrder())
                .thenComparingInt(Keyed::position));

        int limit = Math.min(maxEvents, keyed.size());
        List<DemandEvent> selected = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            selected.add(keyed.get(i).event());
        }
        return selected;
    }

    private record Keyed(DemandEvent event, LocalDate date, int position) {
    }
}
