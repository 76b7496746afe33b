package com.largomodo.bayalloc.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Usage tally of consumed slots per (bay, size class).
 * <p>
 * Created empty (all counts zero) at the start of an allocation pass and owned by that pass.
 * Counts only ever grow. Not thread-safe: one pass, one table.
 */
public class SlotUsage {

    private final Map<String, EnumMap<SizeClass, Integer>> usage = new LinkedHashMap<>();

    public int used(String bayCode, SizeClass sizeClass) {
        EnumMap<SizeClass, Integer> perSize = usage.get(bayCode);
        return perSize == null ? 0 : perSize.getOrDefault(sizeClass, 0);
    }

    /**
     * Records one more consumed slot.
     *
     * @return the new count for (bay, size class)
     */
    public int increment(String bayCode, SizeClass sizeClass) {
        return usage.computeIfAbsent(bayCode, k -> new EnumMap<>(SizeClass.class))
                .merge(sizeClass, 1, Integer::sum);
    }

    /**
     * Consumed slots of a class summed over all bays.
     */
    public int totalUsed(SizeClass sizeClass) {
        int total = 0;
        for (EnumMap<SizeClass, Integer> perSize : usage.values()) {
            total += perSize.getOrDefault(sizeClass, 0);
        }
        return total;
    }

    public int totalUsed() {
        int total = 0;
        for (SizeClass sizeClass : SizeClass.values()) {
            total += totalUsed(sizeClass);
        }
        return total;
    }

    /**
     * Bays with at least one consumed slot, in first-use order.
     */
    public Set<String> bays() {
        return Collections.unmodifiableSet(usage.keySet());
    }
}
