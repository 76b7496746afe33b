package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.Bay;
import com.largomodo.bayalloc.core.domain.Location;
import com.largomodo.bayalloc.core.domain.Provenance;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.largomodo.bayalloc.core.Fixtures.location;
import static org.junit.jupiter.api.Assertions.*;

class BayInventoryBuilderTest {

    private final BayInventoryBuilder builder = new BayInventoryBuilder();

    @Test
    void testGroupsLocationsIntoBays() {
        List<Location> locations = List.of(
                location("A-1-1", "A-1", SizeClass.SMALL),
                location("B-1-1", "B-1", SizeClass.LARGE),
                location("A-1-2", "A-1", SizeClass.SMALL),
                location("A-1-3", "A-1", SizeClass.MEDIUM));

        Map<String, Bay> bays = builder.build(locations);

        assertEquals(List.of("A-1", "B-1"), List.copyOf(bays.keySet()), "First-observed bay order");
        Bay a = bays.get("A-1");
        assertEquals(List.of(SizeClass.SMALL, SizeClass.SMALL, SizeClass.MEDIUM), a.capacityLayout(),
                "Layout keeps member order, not sorted or deduplicated");
        assertEquals(2, a.available(SizeClass.SMALL));
        assertEquals(1, a.available(SizeClass.MEDIUM));
        assertEquals(0, a.available(SizeClass.LARGE));
        assertEquals(3, a.slotCount());
    }

    @Test
    void testCompositionSignatureSortedByCountDescending() {
        List<Location> members = List.of(
                new Location("A-1-1", "A-1", SizeClass.MEDIUM, "BLL", "", "C", Provenance.FROM_MASTER),
                new Location("A-1-2", "A-1", SizeClass.MEDIUM, "PP5", "", "C", Provenance.FROM_MASTER),
                new Location("A-1-3", "A-1", SizeClass.MEDIUM, "PP5", "", "C", Provenance.FROM_MASTER),
                new Location("A-1-4", "A-1", SizeClass.MEDIUM, "BLL", "", "C", Provenance.FROM_MASTER),
                new Location("A-1-5", "A-1", SizeClass.MEDIUM, "PP5", "", "C", Provenance.FROM_MASTER));

        assertEquals("3×PP5,2×BLL", BayInventoryBuilder.compositionSignature(members));
    }

    @Test
    void testCompositionTiesKeepFirstSeenOrder() {
        List<Location> members = List.of(
                new Location("A-1-1", "A-1", SizeClass.SMALL, "PP7", "", "C", Provenance.FROM_MASTER),
                new Location("A-1-2", "A-1", SizeClass.SMALL, "PP3", "", "C", Provenance.FROM_MASTER));

        assertEquals("1×PP7,1×PP3", BayInventoryBuilder.compositionSignature(members));
    }

    @Test
    void testSynthesizedBay() {
        Map<String, Bay> bays = builder.build(List.of(
                Location.synthesized("Z99-14-02", "Z99-14"),
                location("A-1-1", "A-1", SizeClass.SMALL),
                Location.synthesized("A-1-9", "A-1")));

        Bay synthetic = bays.get("Z99-14");
        assertTrue(synthetic.isSynthesized());
        assertEquals(List.of(SizeClass.LARGE), synthetic.capacityLayout());
        assertEquals(1, synthetic.available(SizeClass.LARGE));
        assertEquals("1×UNKNOWN", synthetic.compositionSignature());

        assertFalse(bays.get("A-1").isSynthesized(), "Bay with any master member is a master bay");
    }

    @Test
    void testBayTakesLocationClassOfFirstMember() {
        Map<String, Bay> bays = builder.build(List.of(
                new Location("A-1-1", "A-1", SizeClass.LARGE, "BLH", "", "R", Provenance.FROM_MASTER),
                new Location("A-1-2", "A-1", SizeClass.SMALL, "PP3", "", "C", Provenance.FROM_MASTER)));

        assertEquals("R", bays.get("A-1").locationClass());
    }

    @Test
    void testEmptyAndNullInput() {
        assertTrue(builder.build(List.of()).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> builder.build(null));
    }

    @Property
    void inventoryConservation(@ForAll("locations") List<Location> locations) {
        Map<String, Bay> bays = builder.build(locations);

        int totalSlots = 0;
        for (Bay bay : bays.values()) {
            int inventorySum = bay.inventory().values().stream().mapToInt(Integer::intValue).sum();
            assertEquals(bay.capacityLayout().size(), inventorySum,
                    "Inventory must sum to layout length for bay " + bay.code());
            totalSlots += bay.slotCount();
        }
        assertEquals(locations.size(), totalSlots, "Every location becomes exactly one slot");
    }

    @Provide
    Arbitrary<List<Location>> locations() {
        Arbitrary<String> bayCodes = Arbitraries.of("A-1", "A-2", "B-7", "C-10");
        Arbitrary<SizeClass> sizes = Arbitraries.of(SizeClass.class);
        Arbitrary<Location> single = Combinators.combine(bayCodes, sizes).as((bay, size) ->
                new Location("X", bay, size, "PP3", "", "C", Provenance.FROM_MASTER));
        return single.list().ofMaxSize(40).map(list -> {
            List<Location> unique = new ArrayList<>();
            for (int i = 0; i < list.size(); i++) {
                Location l = list.get(i);
                unique.add(new Location(l.bayCode() + "-" + i, l.bayCode(), l.sizeClass(), l.slotType(), "",
                        l.locationClass(), l.provenance()));
            }
            return unique;
        });
    }
}
