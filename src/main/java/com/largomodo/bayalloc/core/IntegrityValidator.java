package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.AllocationRecord;
import com.largomodo.bayalloc.core.domain.ArticleBayKey;
import com.largomodo.bayalloc.core.domain.Bay;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.Finding;
import com.largomodo.bayalloc.core.domain.Location;
import com.largomodo.bayalloc.core.domain.LocationMapping;
import com.largomodo.bayalloc.core.domain.OverflowRecord;
import com.largomodo.bayalloc.core.domain.Severity;
import com.largomodo.bayalloc.core.domain.ValidationReport;
import com.largomodo.bayalloc.util.Decimals;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Post-hoc consistency checks over the produced bays, assignments and overflow log.
 * <p>
 * Runs a fixed battery of nine independent checks, always all of them, and reports only checks
 * that found something. Findings appear in check order. The validator never throws for bad data
 * and never decides process exit status.
 * <ol>
 *   <li>Demand locations resolve to a known bay (error).</li>
 *   <li>Assigned articles have originating demand (error); demanded articles without any
 *       assignment are overflow-only (warning).</li>
 *   <li>Assignment bays exist (error).</li>
 *   <li>Every demanded (article, bay) pair is assigned or overflowed (warning for overflow pairs,
 *       error for pairs missing from both).</li>
 *   <li>Capacity layouts contain only standard weights (error).</li>
 *   <li>Assignment size classes are standard (warning).</li>
 *   <li>No duplicate bay codes or (article, bay) assignments (error).</li>
 *   <li>Demand location codes exist in the location mapping (warning).</li>
 *   <li>Assignments per (bay, class) never exceed the inventory (error). A violation means the
 *       allocator is broken, not the data.</li>
 * </ol>
 */
public class IntegrityValidator {

    public ValidationReport validate(Collection<Bay> bays, List<AllocationRecord> allocations,
                                     List<OverflowRecord> overflows, List<DemandEvent> demandEvents,
                                     LocationMapping mapping) {
        if (bays == null || allocations == null || overflows == null || demandEvents == null || mapping == null) {
            throw new IllegalArgumentException("Validation inputs cannot be null");
        }

        Map<String, Bay> bayIndex = new HashMap<>();
        for (Bay bay : bays) {
            bayIndex.putIfAbsent(bay.code(), bay);
        }

        List<Finding> findings = new ArrayList<>();
        checkDemandLocations(demandEvents, mapping, bayIndex, findings);
        checkArticleCoverage(allocations, demandEvents, mapping, bayIndex, findings);
        checkAllocationBays(allocations, bayIndex, findings);
        checkPairCoverage(allocations, overflows, demandEvents, mapping, bayIndex, findings);
        checkCapacityLayouts(bays, findings);
        checkAllocationSizes(allocations, findings);
        checkDuplicateKeys(bays, allocations, findings);
        checkOriginalLocations(demandEvents, mapping, findings);
        checkCapacity(bays, allocations, findings);
        return new ValidationReport(findings);
    }

    // 1
    private void checkDemandLocations(List<DemandEvent> events, LocationMapping mapping, Map<String, Bay> bays,
                                      List<Finding> findings) {
        Offenders offenders = new Offenders();
        for (DemandEvent event : events) {
            if (bayOf(event, mapping, bays).isEmpty()) {
                offenders.add(event.locationCode());
            }
        }
        offenders.report(findings, "Pick", Severity.ERROR, "Missing Location",
                "Demand events reference locations that do not resolve to a known bay");
    }

    // 2
    private void checkArticleCoverage(List<AllocationRecord> allocations, List<DemandEvent> events,
                                      LocationMapping mapping, Map<String, Bay> bays, List<Finding> findings) {
        Set<Long> demanded = new LinkedHashSet<>();
        for (DemandEvent event : events) {
            if (bayOf(event, mapping, bays).isPresent()) {
                demanded.add(event.article());
            }
        }
        Set<Long> allocated = new LinkedHashSet<>();
        for (AllocationRecord record : allocations) {
            allocated.add(record.article());
        }

        Offenders withoutDemand = new Offenders();
        for (Long article : allocated) {
            if (!demanded.contains(article)) {
                withoutDemand.add(String.valueOf(article));
            }
        }
        withoutDemand.report(findings, "ArticleLocation", Severity.ERROR, "Allocation Without Demand",
                "Assigned articles have no originating demand event");

        Offenders overflowOnly = new Offenders();
        for (Long article : demanded) {
            if (!allocated.contains(article)) {
                overflowOnly.add(String.valueOf(article));
            }
        }
        overflowOnly.report(findings, "Pick", Severity.WARNING, "Missing Article",
                "Demanded articles received no slot in any bay");
    }

    // 3
    private void checkAllocationBays(List<AllocationRecord> allocations, Map<String, Bay> bays,
                                     List<Finding> findings) {
        Offenders offenders = new Offenders();
        for (AllocationRecord record : allocations) {
            if (!bays.containsKey(record.bayCode())) {
                offenders.add(record.bayCode());
            }
        }
        offenders.report(findings, "ArticleLocation", Severity.ERROR, "Missing Location",
                "Assignments reference bays not in the bay set");
    }

    // 4
    private void checkPairCoverage(List<AllocationRecord> allocations, List<OverflowRecord> overflows,
                                   List<DemandEvent> events, LocationMapping mapping, Map<String, Bay> bays,
                                   List<Finding> findings) {
        Set<ArticleBayKey> allocated = new HashSet<>();
        for (AllocationRecord record : allocations) {
            allocated.add(record.key());
        }
        Set<ArticleBayKey> overflowed = new HashSet<>();
        for (OverflowRecord record : overflows) {
            overflowed.add(record.key());
        }

        Set<ArticleBayKey> demandedPairs = new LinkedHashSet<>();
        for (DemandEvent event : events) {
            bayOf(event, mapping, bays).ifPresent(bay -> demandedPairs.add(new ArticleBayKey(event.article(), bay.code())));
        }

        Offenders overflowPairs = new Offenders();
        Offenders missingPairs = new Offenders();
        for (ArticleBayKey pair : demandedPairs) {
            if (allocated.contains(pair)) {
                continue;
            }
            if (overflowed.contains(pair)) {
                overflowPairs.add(pair.toString());
            } else {
                missingPairs.add(pair.toString());
            }
        }
        overflowPairs.report(findings, "Pick", Severity.WARNING, "Overflow Article-Location Pair",
                "Demanded article-bay pairs were not assigned because the bay was full");
        missingPairs.report(findings, "Pick", Severity.ERROR, "Missing Article-Location Pair",
                "Demanded article-bay pairs appear in neither assignments nor overflow");
    }

    // 5
    private void checkCapacityLayouts(Collection<Bay> bays, List<Finding> findings) {
        Offenders offenders = new Offenders();
        for (Bay bay : bays) {
            List<String> invalid = new ArrayList<>();
            for (SizeClass sizeClass : bay.capacityLayout()) {
                if (sizeClass == null || !SizeClass.isStandardWeight(sizeClass.getWeight())) {
                    invalid.add(sizeClass == null ? "null" : Decimals.formatWeight(sizeClass.getWeight()));
                }
            }
            if (!invalid.isEmpty()) {
                offenders.add(bay.code() + " (invalid: " + String.join(", ", invalid) + ")");
            }
        }
        offenders.report(findings, "Location", Severity.ERROR, "Invalid Capacity Layout Values",
                "Capacity layouts contain values other than 0,25, 0,50 or 1,00");
    }

    // 6
    private void checkAllocationSizes(List<AllocationRecord> allocations, List<Finding> findings) {
        Offenders offenders = new Offenders();
        for (AllocationRecord record : allocations) {
            if (record.sizeClass() == null || !SizeClass.isStandardWeight(record.sizeClass().getWeight())) {
                offenders.add("Article " + record.article() + " @ " + record.bayCode() + " = " + record.sizeClass());
            }
        }
        offenders.report(findings, "ArticleLocation", Severity.WARNING, "Invalid Location Size",
                "Assignment size classes outside 0,25, 0,50 and 1,00");
    }

    // 7
    private void checkDuplicateKeys(Collection<Bay> bays, List<AllocationRecord> allocations,
                                    List<Finding> findings) {
        Map<String, Integer> bayCounts = new LinkedHashMap<>();
        for (Bay bay : bays) {
            bayCounts.merge(bay.code(), 1, Integer::sum);
        }
        Offenders duplicateBays = new Offenders();
        bayCounts.forEach((code, count) -> {
            if (count > 1) {
                duplicateBays.add(code + " (" + count + "×)");
            }
        });
        duplicateBays.report(findings, "Location", Severity.ERROR, "Duplicate Location",
                "Duplicate bay codes found");

        Map<ArticleBayKey, Integer> pairCounts = new LinkedHashMap<>();
        for (AllocationRecord record : allocations) {
            pairCounts.merge(record.key(), 1, Integer::sum);
        }
        Offenders duplicatePairs = new Offenders();
        pairCounts.forEach((pair, count) -> {
            if (count > 1) {
                duplicatePairs.add(pair + " (" + count + "×)");
            }
        });
        duplicatePairs.report(findings, "ArticleLocation", Severity.ERROR, "Duplicate Article-Location Pair",
                "Duplicate article-bay assignments found");
    }

    // 8
    private void checkOriginalLocations(List<DemandEvent> events, LocationMapping mapping, List<Finding> findings) {
        Offenders offenders = new Offenders();
        for (DemandEvent event : events) {
            if (!event.locationCode().isEmpty() && !mapping.contains(event.locationCode())) {
                offenders.add(event.locationCode());
            }
        }
        offenders.report(findings, "Pick", Severity.WARNING, "Invalid Original Location",
                "Demand location codes have no entry in the location mapping");
    }

    // 9
    private void checkCapacity(Collection<Bay> bays, List<AllocationRecord> allocations, List<Finding> findings) {
        Map<String, EnumMap<SizeClass, Integer>> assigned = new HashMap<>();
        for (AllocationRecord record : allocations) {
            if (record.sizeClass() != null) {
                assigned.computeIfAbsent(record.bayCode(), k -> new EnumMap<>(SizeClass.class))
                        .merge(record.sizeClass(), 1, Integer::sum);
            }
        }

        Offenders violations = new Offenders();
        Set<String> checked = new HashSet<>();
        for (Bay bay : bays) {
            if (!checked.add(bay.code())) {
                continue;
            }
            EnumMap<SizeClass, Integer> perSize = assigned.getOrDefault(bay.code(), new EnumMap<>(SizeClass.class));
            for (SizeClass sizeClass : SizeClass.values()) {
                int count = perSize.getOrDefault(sizeClass, 0);
                int available = bay.available(sizeClass);
                if (count > available) {
                    violations.add(bay.code() + " size " + Decimals.formatWeight(sizeClass.getWeight()) + ": "
                            + count + " assigned > " + available + " available");
                }
            }
        }
        violations.report(findings, "ArticleLocation", Severity.ERROR, "Capacity Constraint Violation",
                "More articles assigned than available slots");
    }

    private static Optional<Bay> bayOf(DemandEvent event, LocationMapping mapping, Map<String, Bay> bays) {
        return mapping.resolve(event.locationCode())
                .map(Location::bayCode)
                .map(bays::get);
    }

    /**
     * Counts offending items and keeps the first {@value Finding#MAX_SAMPLES} as samples.
     */
    private static final class Offenders {
        private final List<String> samples = new ArrayList<>();
        private int count;

        void add(String key) {
            count++;
            if (samples.size() < Finding.MAX_SAMPLES) {
                samples.add(key);
            }
        }

        void report(List<Finding> findings, String scope, Severity severity, String category, String description) {
            if (count > 0) {
                findings.add(new Finding(scope, severity, category, description, count, samples));
            }
        }
    }
}
