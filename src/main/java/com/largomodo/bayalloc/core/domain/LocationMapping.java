package com.largomodo.bayalloc.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Frozen raw-code to location mapping, with the audit trail and data-quality findings
 * gathered while building it.
 * <p>
 * Iteration order is master order followed by synthesis order.
 */
public final class LocationMapping {

    private final Map<String, Location> locations;
    private final List<LocationAudit> audit;
    private final List<Finding> findings;
    private final List<String> unresolvableCodes;

    public LocationMapping(List<LocationAudit> audit, List<Finding> findings, List<String> unresolvableCodes) {
        Map<String, Location> byCode = new LinkedHashMap<>();
        for (LocationAudit entry : audit) {
            Location location = entry.location();
            if (byCode.putIfAbsent(location.code(), location) != null) {
                throw new IllegalArgumentException("Duplicate location code in mapping: " + location.code());
            }
        }
        this.locations = Collections.unmodifiableMap(byCode);
        this.audit = List.copyOf(audit);
        this.findings = List.copyOf(findings);
        this.unresolvableCodes = List.copyOf(unresolvableCodes);
    }

    /**
     * Builds a mapping without audit flags, marking every location as master-sourced or
     * pick-referenced according to its provenance. Mainly useful for callers that assemble
     * locations themselves.
     */
    public static LocationMapping of(List<Location> locations) {
        List<LocationAudit> entries = new ArrayList<>();
        for (Location location : locations) {
            boolean fromMaster = !location.isSynthesized();
            entries.add(new LocationAudit(location, fromMaster, false, !fromMaster, fromMaster ? 0 : 1));
        }
        return new LocationMapping(entries, List.of(), List.of());
    }

    public Optional<Location> resolve(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(locations.get(code.trim()));
    }

    public boolean contains(String code) {
        return resolve(code).isPresent();
    }

    /**
     * All locations keyed by raw code, in resolution order.
     */
    public Map<String, Location> locations() {
        return locations;
    }

    public List<LocationAudit> audit() {
        return audit;
    }

    /**
     * Data-quality findings from resolution (unknown article pick locations, duplicate master rows).
     */
    public List<Finding> findings() {
        return findings;
    }

    /**
     * Distinct demand location codes that could not be resolved or synthesized, in first-seen order.
     */
    public List<String> unresolvableCodes() {
        return unresolvableCodes;
    }

    public int size() {
        return locations.size();
    }

    public long synthesizedCount() {
        return locations.values().stream().filter(Location::isSynthesized).count();
    }
}
