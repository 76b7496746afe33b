package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.AllocationResult;
import com.largomodo.bayalloc.core.domain.Bay;
import com.largomodo.bayalloc.core.domain.BayPick;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.LocationMapping;
import com.largomodo.bayalloc.core.domain.ValidationReport;

import java.util.List;
import java.util.Map;

/**
 * Everything one run produces, handed read-only to reporting.
 *
 * @param consideredEvents demand events kept after recency ordering and the cap
 * @param totalEvents      demand events read before the cap
 * @param mapping          frozen location mapping with audit trail
 * @param bays             bays keyed by code, in grouping order
 * @param allocation       assignments, overflow and counters
 * @param bayPicks         considered events at bay level
 * @param report           resolver findings followed by integrity findings
 */
public record PipelineResult(List<DemandEvent> consideredEvents, int totalEvents, LocationMapping mapping,
                             Map<String, Bay> bays, AllocationResult allocation, List<BayPick> bayPicks,
                             ValidationReport report) {

    public PipelineResult {
        consideredEvents = List.copyOf(consideredEvents);
        bayPicks = List.copyOf(bayPicks);
    }
}
