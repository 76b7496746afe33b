package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.ArticleRecord;
import com.largomodo.bayalloc.core.domain.BayCodes;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.Finding;
import com.largomodo.bayalloc.core.domain.Location;
import com.largomodo.bayalloc.core.domain.LocationAudit;
import com.largomodo.bayalloc.core.domain.LocationMapping;
import com.largomodo.bayalloc.core.domain.LocationMasterRecord;
import com.largomodo.bayalloc.core.domain.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciles location codes from the location master, the article master and demand events
 * into one frozen {@link LocationMapping}.
 * <ol>
 *   <li>Master rows seed the mapping (first row wins for a repeated code).</li>
 *   <li>Article pick locations are cross-checked; unknown codes become a warning, never an entry.</li>
 *   <li>Demand codes absent from the master are synthesized into a LARGE placeholder in the bay
 *       inferred from the code. Codes without a bay shape are left unresolved.</li>
 * </ol>
 */
public class LocationBayResolver {

    private static final Logger log = LoggerFactory.getLogger(LocationBayResolver.class);

    /**
     * @throws IllegalArgumentException if any argument is null
     */
    public LocationMapping resolve(List<LocationMasterRecord> masterLocations, List<ArticleRecord> articleRecords,
                                   List<DemandEvent> demandEvents) {
        if (masterLocations == null || articleRecords == null || demandEvents == null) {
            throw new IllegalArgumentException("Master locations, articles and demand events cannot be null");
        }

        Map<String, Entry> entries = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        for (LocationMasterRecord row : masterLocations) {
            String code = row.code().trim();
            if (entries.containsKey(code)) {
                duplicates.add(code);
                continue;
            }
            Entry entry = new Entry(Location.fromMaster(withTrimmedCode(row, code)));
            entry.inLocations = true;
            entries.put(code, entry);
        }

        List<String> unknownArticleLocations = new ArrayList<>();
        for (ArticleRecord article : articleRecords) {
            String code = article.pickLocation();
            if (code.isEmpty()) {
                continue;
            }
            Entry entry = entries.get(code);
            if (entry != null) {
                entry.inArticles = true;
            } else {
                log.debug("Article {} references unknown location: {}", article.article(), code);
                unknownArticleLocations.add(article.article() + "→" + code);
            }
        }

        Set<String> unresolvable = new LinkedHashSet<>();
        for (DemandEvent event : demandEvents) {
            String code = event.locationCode();
            if (code.isEmpty()) {
                continue;
            }
            Entry entry = entries.get(code);
            if (entry == null) {
                Optional<String> bayCode = BayCodes.infer(code);
                if (bayCode.isEmpty()) {
                    unresolvable.add(code);
                    continue;
                }
                entry = new Entry(Location.synthesized(code, bayCode.get()));
                entries.put(code, entry);
            }
            entry.inPicks = true;
            entry.pickCount++;
        }

        List<LocationAudit> audit = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            audit.add(entry.freeze());
        }

        List<Finding> findings = new ArrayList<>();
        if (!duplicates.isEmpty()) {
            log.warn("{} duplicate location codes in master, first occurrence kept", duplicates.size());
            findings.add(new Finding("Location", Severity.WARNING, "Duplicate Master Location",
                    "Location master repeats codes; later rows were ignored", duplicates.size(), duplicates));
        }
        if (!unknownArticleLocations.isEmpty()) {
            log.warn("{} articles reference pick locations not in the location master",
                    unknownArticleLocations.size());
            findings.add(new Finding("Article", Severity.WARNING, "Unknown Article Pick Location",
                    "Article master references pick locations not in the location master",
                    unknownArticleLocations.size(), unknownArticleLocations));
        }
        if (!unresolvable.isEmpty()) {
            log.warn("{} demand location codes have no bay shape and cannot be routed", unresolvable.size());
        }

        LocationMapping mapping = new LocationMapping(audit, findings, new ArrayList<>(unresolvable));
        log.debug("Resolved {} locations ({} synthesized)", mapping.size(), mapping.synthesizedCount());
        return mapping;
    }

    private static LocationMasterRecord withTrimmedCode(LocationMasterRecord row, String code) {
        if (row.code().equals(code)) {
            return row;
        }
        return new LocationMasterRecord(code, row.aisle(), row.bay(), row.area(), row.slotType(),
                row.slotTypeDescription(), row.locationClass(), row.warehouse());
    }

    /**
     * Mutable audit state while resolving; frozen into a {@link LocationAudit} afterwards.
     */
    private static final class Entry {
        private final Location location;
        private boolean inLocations;
        private boolean inArticles;
        private boolean inPicks;
        private int pickCount;

        private Entry(Location location) {
            this.location = location;
        }

        private LocationAudit freeze() {
            return new LocationAudit(location, inLocations, inArticles, inPicks, pickCount);
        }
    }
}
