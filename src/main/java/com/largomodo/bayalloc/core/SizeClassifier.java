package com.largomodo.bayalloc.core;

import java.util.Map;

/**
 * Maps raw slot-type codes from the location master to standardized size classes.
 * <p>
 * The table is fixed. Unknown, blank and reserve codes (no slot type) classify as LARGE:
 * treating an unknown slot as large under-allocates small capacity instead of losing a slot.
 * <p>
 * Stateless utility, safe for concurrent use.
 */
public class SizeClassifier {

    /** Code assigned to locations whose slot type is absent. */
    public static final String UNKNOWN_SLOT_TYPE = "UNKNOWN";

    // Blokpallet hoog/dubbel, blokpallet laag + DKW 5, shelf and plank types
    private static final Map<String, SizeClass> SLOT_TYPES = Map.ofEntries(
            Map.entry("BLH", SizeClass.LARGE),
            Map.entry("BLN", SizeClass.LARGE),
            Map.entry("BLL", SizeClass.MEDIUM),
            Map.entry("PP5", SizeClass.MEDIUM),
            Map.entry("PP3", SizeClass.SMALL),
            Map.entry("PP7", SizeClass.SMALL),
            Map.entry("PP9", SizeClass.SMALL),
            Map.entry("PK", SizeClass.SMALL),
            Map.entry("PLK", SizeClass.SMALL),
            Map.entry("PLV", SizeClass.SMALL)
    );

    private SizeClassifier() {
        // Static utility class - prevent instantiation
    }

    /**
     * Classify a raw slot-type code.
     *
     * @param slotTypeCode code such as "PP5", may be null
     * @return size class, LARGE for any code outside the table
     */
    public static SizeClass classify(String slotTypeCode) {
        if (slotTypeCode == null) {
            return SizeClass.LARGE;
        }
        return SLOT_TYPES.getOrDefault(slotTypeCode.trim(), SizeClass.LARGE);
    }
}
