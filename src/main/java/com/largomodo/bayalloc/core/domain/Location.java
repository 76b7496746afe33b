package com.largomodo.bayalloc.core.domain;

import com.largomodo.bayalloc.core.SizeClass;
import com.largomodo.bayalloc.core.SizeClassifier;

/**
 * One physical slot, resolved to its owning bay and size class.
 * <p>
 * Locations are either {@link Provenance#FROM_MASTER known} (one per master row) or
 * {@link Provenance#SYNTHESIZED synthesized} for codes seen only in demand events. Synthesized
 * locations always carry {@link SizeClass#LARGE} and the {@code UNKNOWN} slot type.
 *
 * @param code                raw location code, e.g. "D11-021-11"
 * @param bayCode             owning bay code, e.g. "11-021"
 * @param sizeClass           size class derived from the slot type
 * @param slotType            raw slot-type code ("UNKNOWN" when absent)
 * @param slotTypeDescription human-readable slot type
 * @param locationClass       master location class ("C" case pick, "R" reserve), empty if unknown
 * @param provenance          where this entry came from
 */
public record Location(String code, String bayCode, SizeClass sizeClass, String slotType,
                       String slotTypeDescription, String locationClass, Provenance provenance) {

    public Location {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code must not be null or blank");
        }
        if (bayCode == null || bayCode.isBlank()) {
            throw new IllegalArgumentException("bayCode must not be null or blank for location " + code);
        }
        if (sizeClass == null) {
            throw new IllegalArgumentException("sizeClass must not be null for location " + code);
        }
        if (provenance == null) {
            throw new IllegalArgumentException("provenance must not be null for location " + code);
        }
        slotType = slotType == null || slotType.isBlank() ? SizeClassifier.UNKNOWN_SLOT_TYPE : slotType;
        slotTypeDescription = slotTypeDescription == null ? "" : slotTypeDescription;
        locationClass = locationClass == null ? "" : locationClass;
    }

    /**
     * Creates the location for a master row, classifying its slot type.
     */
    public static Location fromMaster(LocationMasterRecord row) {
        String slotType = row.slotType() == null || row.slotType().isBlank()
                ? SizeClassifier.UNKNOWN_SLOT_TYPE
                : row.slotType();
        String description = row.slotTypeDescription() == null || row.slotTypeDescription().isBlank()
                ? "Unknown"
                : row.slotTypeDescription();
        return new Location(row.code(), row.bayCode(), SizeClassifier.classify(slotType), slotType,
                description, row.locationClass(), Provenance.FROM_MASTER);
    }

    /**
     * Creates a placeholder for a code referenced by demand but absent from the master.
     */
    public static Location synthesized(String code, String bayCode) {
        return new Location(code, bayCode, SizeClass.LARGE, SizeClassifier.UNKNOWN_SLOT_TYPE,
                "Not in master data", "", Provenance.SYNTHESIZED);
    }

    public boolean isSynthesized() {
        return provenance == Provenance.SYNTHESIZED;
    }
}
