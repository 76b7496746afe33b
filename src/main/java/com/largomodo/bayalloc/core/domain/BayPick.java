package com.largomodo.bayalloc.core.domain;

/**
 * A demand event re-expressed at bay level for export.
 *
 * @param pickList           synthetic pick list id
 * @param bayCode            bay the original location belongs to
 * @param article            article number
 * @param quantity           picked base units
 * @param pickDate           pick date formatted D-M-YYYY
 * @param salesOrder         pick order number
 * @param salesOrderCategory order category
 * @param originalLocation   raw location code of the event
 */
public record BayPick(long pickList, String bayCode, long article, int quantity, String pickDate,
                      String salesOrder, String salesOrderCategory, String originalLocation) {
}
