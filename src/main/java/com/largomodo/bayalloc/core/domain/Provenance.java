package com.largomodo.bayalloc.core.domain;

/**
 * Origin of a location entry: read from the location master, or inferred from demand data.
 */
public enum Provenance {
    FROM_MASTER,
    SYNTHESIZED
}
