package com.largomodo.bayalloc.core.domain;

import com.largomodo.bayalloc.core.SizeClass;

/**
 * A demand event that found its bay's slots of the required class exhausted.
 * Overflow is an expected outcome, not an error.
 *
 * @param article        article number
 * @param bayCode        targeted bay
 * @param sizeClass      exhausted size class
 * @param sourceLocation raw location code of the event
 * @param timestamp      pick timestamp as exported, or the delivery date when the pick has none
 */
public record OverflowRecord(long article, String bayCode, SizeClass sizeClass, String sourceLocation,
                             String timestamp) {

    public static final String REASON = "capacity exhausted";

    public ArticleBayKey key() {
        return new ArticleBayKey(article, bayCode);
    }
}
