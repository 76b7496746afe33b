package com.largomodo.bayalloc.core.domain;

import com.largomodo.bayalloc.core.SizeClass;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BayTest {

    @Test
    void testInventoryHasEveryClass() {
        Bay bay = new Bay("A-1", List.of(SizeClass.SMALL, SizeClass.SMALL),
                Map.of(SizeClass.SMALL, 2), "2×PP3", "C", Provenance.FROM_MASTER);

        assertEquals(2, bay.available(SizeClass.SMALL));
        assertEquals(0, bay.available(SizeClass.MEDIUM));
        assertEquals(0, bay.available(SizeClass.LARGE));
        assertEquals(3, bay.inventory().size());
        assertEquals(2, bay.slotCount());
    }

    @Test
    void testLayoutIsCopiedAndUnmodifiable() {
        List<SizeClass> layout = new ArrayList<>(List.of(SizeClass.LARGE));
        Bay bay = new Bay("A-1", layout, Map.of(SizeClass.LARGE, 1), null, null, null);

        layout.add(SizeClass.SMALL);

        assertEquals(1, bay.slotCount(), "Later changes to the source list must not leak in");
        assertThrows(UnsupportedOperationException.class, () -> bay.capacityLayout().add(SizeClass.SMALL));
        assertThrows(UnsupportedOperationException.class, () -> bay.inventory().put(SizeClass.SMALL, 5));
    }

    @Test
    void testNullLayoutElementsAreKept() {
        Bay bay = new Bay("A-1", Arrays.asList(SizeClass.SMALL, null), Map.of(SizeClass.SMALL, 1),
                "", "", Provenance.FROM_MASTER);

        assertEquals(2, bay.slotCount());
        assertNull(bay.capacityLayout().get(1));
    }

    @Test
    void testDefaults() {
        Bay bay = new Bay("A-2", List.of(), Map.of(), null, null, null);

        assertEquals("", bay.compositionSignature());
        assertEquals("", bay.locationClass());
        assertEquals(Provenance.FROM_MASTER, bay.provenance());
        assertFalse(bay.isSynthesized());
        assertTrue(bay.isEvenZone());
    }

    @Test
    void testRejectsBlankCode() {
        assertThrows(IllegalArgumentException.class,
                () -> new Bay(" ", List.of(), Map.of(), "", "", Provenance.FROM_MASTER));
        assertThrows(IllegalArgumentException.class,
                () -> new Bay("A-1", null, Map.of(), "", "", Provenance.FROM_MASTER));
    }
}
