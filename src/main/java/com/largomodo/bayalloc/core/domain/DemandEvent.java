package com.largomodo.bayalloc.core.domain;

import com.largomodo.bayalloc.util.PickDates;

import java.time.LocalDate;

/**
 * One historical pick, read-only.
 *
 * @param sequence     0-based position among the kept input rows
 * @param article      article number
 * @param locationCode raw location code the pick was taken from
 * @param pickDateTime pick timestamp as exported, e.g. "04-07-2025 13:45"
 * @param deliveryDate fallback date when the pick timestamp is blank
 * @param quantity     picked base units
 * @param orderNumber  pick order number
 * @param orderType    order category
 */
public record DemandEvent(int sequence, long article, String locationCode, String pickDateTime,
                          String deliveryDate, int quantity, String orderNumber, String orderType) {

    public DemandEvent {
        locationCode = locationCode == null ? "" : locationCode.trim();
        pickDateTime = pickDateTime == null ? "" : pickDateTime;
        deliveryDate = deliveryDate == null ? "" : deliveryDate;
        orderNumber = orderNumber == null ? "" : orderNumber;
        orderType = orderType == null ? "" : orderType;
    }

    /**
     * Raw date text used for ordering: the pick timestamp, or the delivery date when blank.
     */
    public String dateSource() {
        return pickDateTime.isBlank() ? deliveryDate : pickDateTime;
    }

    /**
     * Date used for recency ordering; {@link PickDates#UNPARSED} when no date can be parsed.
     */
    public LocalDate derivedDate() {
        return PickDates.derive(dateSource());
    }
}
