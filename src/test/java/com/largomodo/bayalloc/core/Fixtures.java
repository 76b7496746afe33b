package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.Bay;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.Location;
import com.largomodo.bayalloc.core.domain.LocationMasterRecord;
import com.largomodo.bayalloc.core.domain.Provenance;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Small builders for hand-made allocation scenarios.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static LocationMasterRecord master(String code, String aisle, String bay, String slotType) {
        return new LocationMasterRecord(code, aisle, bay, "D", slotType, slotType + " slot", "C", "1");
    }

    public static Location location(String code, String bayCode, SizeClass sizeClass) {
        return new Location(code, bayCode, sizeClass, "PP3", "", "C", Provenance.FROM_MASTER);
    }

    public static DemandEvent event(int sequence, long article, String locationCode, String pickDateTime) {
        return new DemandEvent(sequence, article, locationCode, pickDateTime, "", 1, "PO" + sequence, "STD");
    }

    public static Bay bay(String code, SizeClass... layout) {
        Map<SizeClass, Integer> inventory = new EnumMap<>(SizeClass.class);
        for (SizeClass sizeClass : layout) {
            inventory.merge(sizeClass, 1, Integer::sum);
        }
        return new Bay(code, List.of(layout), inventory, "", "C", Provenance.FROM_MASTER);
    }
}
