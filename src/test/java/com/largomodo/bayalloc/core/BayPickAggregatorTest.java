package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.BayPick;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.LocationMapping;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.largomodo.bayalloc.core.Fixtures.location;
import static org.junit.jupiter.api.Assertions.*;

class BayPickAggregatorTest {

    private final BayPickAggregator aggregator = new BayPickAggregator();

    private final LocationMapping mapping = LocationMapping.of(List.of(
            location("A-1-1", "A-1", SizeClass.SMALL),
            location("A-1-2", "A-1", SizeClass.SMALL),
            location("B-2-1", "B-2", SizeClass.LARGE)));

    @Test
    void testGroupsByBayThenArticle() {
        List<DemandEvent> events = List.of(
                new DemandEvent(0, 10, "A-1-1", "04-07-2025 09:15", "", 3, "PO1", "STD"),
                new DemandEvent(1, 20, "B-2-1", "03-07-2025 09:15", "", 1, "PO2", "RUSH"),
                new DemandEvent(2, 30, "A-1-2", "02-07-2025 09:15", "", 2, "PO3", "STD"),
                new DemandEvent(3, 10, "A-1-2", "01-07-2025 09:15", "", 5, "PO4", "STD"));

        List<BayPick> picks = aggregator.aggregate(events, mapping);

        assertEquals(4, picks.size());
        assertEquals(List.of("A-1", "A-1", "A-1", "B-2"), picks.stream().map(BayPick::bayCode).toList());
        assertEquals(List.of(10L, 10L, 30L, 20L), picks.stream().map(BayPick::article).toList(),
                "Articles grouped in first-seen order within a bay");
        assertEquals(List.of(10081994L, 10081997L, 10081996L, 10081995L),
                picks.stream().map(BayPick::pickList).toList(),
                "Pick list number follows position among considered events");
    }

    @Test
    void testCarriesOrderMetadataAndFormatsDate() {
        List<DemandEvent> events = List.of(
                new DemandEvent(0, 10, "A-1-1", "04-07-2025 09:15", "", 3, "PO1", "STD"));

        BayPick pick = aggregator.aggregate(events, mapping).get(0);

        assertEquals(3, pick.quantity());
        assertEquals("4-7-2025", pick.pickDate());
        assertEquals("PO1", pick.salesOrder());
        assertEquals("STD", pick.salesOrderCategory());
        assertEquals("A-1-1", pick.originalLocation());
    }

    @Test
    void testUnresolvedEventsLeftOut() {
        List<DemandEvent> events = List.of(
                new DemandEvent(0, 10, "NOWHERE", "", "", 1, "", ""),
                new DemandEvent(1, 20, "A-1-1", "", "03-07-2025", 1, "", ""));

        List<BayPick> picks = aggregator.aggregate(events, mapping);

        assertEquals(1, picks.size());
        assertEquals(BayPickAggregator.PICK_LIST_BASE + 1, picks.get(0).pickList());
        assertEquals("3-7-2025", picks.get(0).pickDate(), "Delivery date used when pick timestamp is blank");
    }
}
