package com.largomodo.bayalloc.core.domain;

/**
 * Deduplication key of an assignment: one slot per article per bay.
 */
public record ArticleBayKey(long article, String bayCode) {

    @Override
    public String toString() {
        return article + "-" + bayCode;
    }
}
