package com.largomodo.bayalloc.core.domain;

/**
 * One row of the client location master.
 *
 * @param code                raw location code (required)
 * @param aisle               aisle designator
 * @param bay                 bay number within the aisle
 * @param area                pick area, e.g. "D"
 * @param slotType            slot-type code, may be blank for reserve locations
 * @param slotTypeDescription slot-type description
 * @param locationClass       "C" (case pick) or "R" (reserve)
 * @param warehouse           warehouse number
 */
public record LocationMasterRecord(String code, String aisle, String bay, String area, String slotType,
                                   String slotTypeDescription, String locationClass, String warehouse) {

    public LocationMasterRecord {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code must not be null or blank");
        }
    }

    /**
     * Bay code rendered from the structural aisle/bay pair: {@code aisle-bay}.
     */
    public String bayCode() {
        return BayCodes.of(aisle, bay);
    }
}
