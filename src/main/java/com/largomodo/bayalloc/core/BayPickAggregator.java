package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.BayPick;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.Location;
import com.largomodo.bayalloc.core.domain.LocationMapping;
import com.largomodo.bayalloc.util.PickDates;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Re-expresses considered demand events at bay level.
 * <p>
 * Output is grouped by bay in first-seen order, then by article in first-seen order within the
 * bay, keeping event order inside each group. Events whose location does not resolve are left out.
 */
public class BayPickAggregator {

    /** Base of the synthetic pick list numbering; the n-th considered event gets base + n. */
    public static final long PICK_LIST_BASE = 10081994L;

    public List<BayPick> aggregate(List<DemandEvent> consideredEvents, LocationMapping mapping) {
        if (consideredEvents == null || mapping == null) {
            throw new IllegalArgumentException("Events and mapping cannot be null");
        }

        Map<String, Map<Long, List<BayPick>>> byBay = new LinkedHashMap<>();
        for (int i = 0; i < consideredEvents.size(); i++) {
            DemandEvent event = consideredEvents.get(i);
            Optional<Location> location = mapping.resolve(event.locationCode());
            if (location.isEmpty()) {
                continue;
            }
            String bayCode = location.get().bayCode();
            BayPick pick = new BayPick(PICK_LIST_BASE + i, bayCode, event.article(), event.quantity(),
                    PickDates.format(event.dateSource()), event.orderNumber(), event.orderType(),
                    event.locationCode());
            byBay.computeIfAbsent(bayCode, k -> new LinkedHashMap<>())
                    .computeIfAbsent(event.article(), k -> new ArrayList<>())
                    .add(pick);
        }

        List<BayPick> picks = new ArrayList<>();
        for (Map<Long, List<BayPick>> byArticle : byBay.values()) {
            byArticle.values().forEach(picks::addAll);
        }
        return picks;
    }
}
