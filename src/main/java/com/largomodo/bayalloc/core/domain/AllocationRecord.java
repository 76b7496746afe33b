package com.largomodo.bayalloc.core.domain;

import com.largomodo.bayalloc.core.SizeClass;

/**
 * An article assigned to one slot of a bay.
 *
 * @param article        article number
 * @param bayCode        bay the slot belongs to
 * @param sizeClass      size class of the consumed slot (the pick location's class)
 * @param sourceLocation raw location code of the demand event that earned the slot
 * @param provenance     provenance of the owning bay
 */
public record AllocationRecord(long article, String bayCode, SizeClass sizeClass, String sourceLocation,
                               Provenance provenance) {

    public ArticleBayKey key() {
        return new ArticleBayKey(article, bayCode);
    }
}
