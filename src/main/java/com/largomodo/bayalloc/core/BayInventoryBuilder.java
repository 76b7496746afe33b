package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.Bay;
import com.largomodo.bayalloc.core.domain.Location;
import com.largomodo.bayalloc.core.domain.Provenance;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Groups resolved locations into bays and derives each bay's slot inventory.
 * <p>
 * Bays and their members keep first-observed order, so master locations precede synthesized ones.
 */
public class BayInventoryBuilder {

    /**
     * @param locations resolved locations in resolution order, must not be null
     * @return bays keyed by bay code, in first-observed order (unmodifiable)
     * @throws IllegalArgumentException if locations is null
     */
    public Map<String, Bay> build(Collection<Location> locations) {
        if (locations == null) {
            throw new IllegalArgumentException("Locations cannot be null");
        }

        Map<String, List<Location>> groups = new LinkedHashMap<>();
        for (Location location : locations) {
            groups.computeIfAbsent(location.bayCode(), k -> new ArrayList<>()).add(location);
        }

        Map<String, Bay> bays = new LinkedHashMap<>();
        groups.forEach((bayCode, members) -> bays.put(bayCode, toBay(bayCode, members)));
        return Collections.unmodifiableMap(bays);
    }

    private Bay toBay(String bayCode, List<Location> members) {
        List<SizeClass> layout = new ArrayList<>(members.size());
        EnumMap<SizeClass, Integer> inventory = new EnumMap<>(SizeClass.class);
        for (SizeClass sizeClass : SizeClass.values()) {
            inventory.put(sizeClass, 0);
        }
        for (Location member : members) {
            layout.add(member.sizeClass());
            inventory.merge(member.sizeClass(), 1, Integer::sum);
        }

        boolean allSynthesized = members.stream().allMatch(Location::isSynthesized);
        return new Bay(bayCode, layout, inventory, compositionSignature(members),
                members.get(0).locationClass(),
                allSynthesized ? Provenance.SYNTHESIZED : Provenance.FROM_MASTER);
    }

    /**
     * Slot-type counts sorted by count descending, ties in first-seen order: "5×PP5,2×BLL".
     * Descriptive only; allocation never reads it.
     */
    public static String compositionSignature(List<Location> members) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Location member : members) {
            counts.merge(member.slotType(), 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .map(e -> e.getValue() + "×" + e.getKey())
                .collect(Collectors.joining(","));
    }
}
