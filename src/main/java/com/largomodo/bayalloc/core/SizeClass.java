package com.largomodo.bayalloc.core;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Standardized slot size classes with the capacity weight used in exported layouts.
 * <p>
 * Weights exist for external representation only. Allocation compares classes by
 * identity, never by weight, so rounding in a rendered layout can never change a decision.
 */
public enum SizeClass {
    SMALL(new BigDecimal("0.25")),
    MEDIUM(new BigDecimal("0.50")),
    LARGE(new BigDecimal("1.00"));

    private final BigDecimal weight;

    SizeClass(BigDecimal weight) {
        this.weight = weight;
    }

    public BigDecimal getWeight() {
        return weight;
    }

    /**
     * Maps a rendered weight back to its class.
     * <p>
     * Comparison ignores scale, so {@code 0.5} and {@code 0.50} both resolve to MEDIUM.
     *
     * @param weight weight to look up, may be null
     * @return matching class, or empty for null and non-standard weights
     */
    public static Optional<SizeClass> fromWeight(BigDecimal weight) {
        if (weight == null) {
            return Optional.empty();
        }
        for (SizeClass sizeClass : values()) {
            if (sizeClass.weight.compareTo(weight) == 0) {
                return Optional.of(sizeClass);
            }
        }
        return Optional.empty();
    }

    public static boolean isStandardWeight(BigDecimal weight) {
        return fromWeight(weight).isPresent();
    }
}
