package com.largomodo.bayalloc.core.domain;

import com.largomodo.bayalloc.core.SizeClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable slot inventory of one storage bay.
 * <p>
 * The capacity layout holds one element per member location, in grouping order (not sorted, not
 * deduplicated). The inventory counts layout elements per size class and always has an entry for
 * every class. Both are fixed once built; allocation never recomputes them.
 * <p>
 * Layout elements are copied as given. A builder bug that leaves a null element is not rejected
 * here: integrity validation reports it as an invalid layout value.
 *
 * @param code                 bay code (aisle-bay)
 * @param capacityLayout       ordered size class per physical slot (unmodifiable)
 * @param inventory            slot count per size class (unmodifiable, all classes present)
 * @param compositionSignature descriptive slot-type counts, e.g. "5×PP5,2×BLL"; reporting only
 * @param locationClass        location class of the first member location
 * @param provenance           SYNTHESIZED when every member location is synthesized
 */
public record Bay(String code, List<SizeClass> capacityLayout, Map<SizeClass, Integer> inventory,
                  String compositionSignature, String locationClass, Provenance provenance) {

    public Bay {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Bay code must not be null or blank");
        }
        if (capacityLayout == null || inventory == null) {
            throw new IllegalArgumentException("Bay " + code + " requires a capacity layout and inventory");
        }
        capacityLayout = Collections.unmodifiableList(new ArrayList<>(capacityLayout));
        EnumMap<SizeClass, Integer> counts = new EnumMap<>(SizeClass.class);
        for (SizeClass sizeClass : SizeClass.values()) {
            counts.put(sizeClass, inventory.getOrDefault(sizeClass, 0));
        }
        inventory = Collections.unmodifiableMap(counts);
        compositionSignature = compositionSignature == null ? "" : compositionSignature;
        locationClass = locationClass == null ? "" : locationClass;
        provenance = provenance == null ? Provenance.FROM_MASTER : provenance;
    }

    /**
     * Slots of the given class in this bay.
     */
    public int available(SizeClass sizeClass) {
        return inventory.getOrDefault(sizeClass, 0);
    }

    /**
     * Total physical slots (layout length).
     */
    public int slotCount() {
        return capacityLayout.size();
    }

    public boolean isSynthesized() {
        return provenance == Provenance.SYNTHESIZED;
    }

    public boolean isEvenZone() {
        return BayCodes.isEvenZone(code);
    }
}
