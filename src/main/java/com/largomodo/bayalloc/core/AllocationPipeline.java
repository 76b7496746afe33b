package com.largomodo.bayalloc.core;

import com.largomodo.bayalloc.core.domain.AllocationResult;
import com.largomodo.bayalloc.core.domain.Bay;
import com.largomodo.bayalloc.core.domain.BayPick;
import com.largomodo.bayalloc.core.domain.DemandEvent;
import com.largomodo.bayalloc.core.domain.InputDataset;
import com.largomodo.bayalloc.core.domain.LocationMapping;
import com.largomodo.bayalloc.core.domain.OverflowRecord;
import com.largomodo.bayalloc.core.domain.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bay allocation pipeline orchestrator.
 * <p>
 * Coordinates the one-pass batch workflow:
 * 1. Order demand by recency and apply the event cap
 * 2. Resolve raw location codes, synthesizing missing ones
 * 3. Group locations into bays with fixed inventories
 * 4. Allocate slots first-come-first-served
 * 5. Re-express demand at bay level
 * 6. Validate the produced entities
 * <p>
 * Each stage hands its output read-only to the next. The pipeline never decides exit status.
 */
public class AllocationPipeline {

    private static final Logger log = LoggerFactory.getLogger(AllocationPipeline.class);

    private final LocationBayResolver resolver;
    private final BayInventoryBuilder inventoryBuilder;
    private final AllocationEngine engine;
    private final BayPickAggregator aggregator;
    private final IntegrityValidator validator;

    public AllocationPipeline(AllocationEngine engine) {
        this(new LocationBayResolver(), new BayInventoryBuilder(), engine, new BayPickAggregator(),
                new IntegrityValidator());
    }

    public AllocationPipeline(LocationBayResolver resolver, BayInventoryBuilder inventoryBuilder,
                              AllocationEngine engine, BayPickAggregator aggregator,
                              IntegrityValidator validator) {
        if (resolver == null || inventoryBuilder == null || engine == null || aggregator == null
                || validator == null) {
            throw new IllegalArgumentException("Pipeline collaborators cannot be null");
        }
        this.resolver = resolver;
        this.inventoryBuilder = inventoryBuilder;
        this.engine = engine;
        this.aggregator = aggregator;
        this.validator = validator;
    }

    public PipelineResult run(InputDataset dataset, int maxEvents) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset cannot be null");
        }

        // Resolution only sees the capped selection, so out-of-scope codes are never synthesized
        List<DemandEvent> selected = DemandOrdering.mostRecentFirst(dataset.demandEvents(), maxEvents);
        log.info("Selected {} of {} demand events (most recent first)", selected.size(),
                dataset.demandEvents().size());

        LocationMapping mapping = resolver.resolve(dataset.locations(), dataset.articles(), selected);
        log.info("Resolved {} locations ({} synthesized, {} unresolvable codes)", mapping.size(),
                mapping.synthesizedCount(), mapping.unresolvableCodes().size());

        Map<String, Bay> bays = inventoryBuilder.build(mapping.locations().values());
        log.info("Built {} bays", bays.size());

        AllocationResult allocation = engine.allocate(selected, mapping, bays, maxEvents);
        logUtilization(bays, allocation);

        List<BayPick> bayPicks = aggregator.aggregate(selected, mapping);

        ValidationReport report = validator.validate(bays.values(), allocation.allocations(),
                allocation.overflows(), selected, mapping).prependedWith(mapping.findings());
        log.info("Validation: {} errors, {} warnings", report.errors().size(), report.warnings().size());

        return new PipelineResult(selected, dataset.demandEvents().size(), mapping, bays, allocation,
                bayPicks, report);
    }

    private void logUtilization(Map<String, Bay> bays, AllocationResult allocation) {
        log.info("Allocated {} article-bay pairs, {} overflow, {} already served, {} unroutable",
                allocation.allocations().size(), allocation.overflows().size(), allocation.alreadyServed(),
                allocation.unroutable());

        EnumMap<SizeClass, Integer> overflowBySize = new EnumMap<>(SizeClass.class);
        for (OverflowRecord overflow : allocation.overflows()) {
            overflowBySize.merge(overflow.sizeClass(), 1, Integer::sum);
        }

        for (SizeClass sizeClass : SizeClass.values()) {
            int available = 0;
            for (Bay bay : bays.values()) {
                available += bay.available(sizeClass);
            }
            int used = allocation.usage().totalUsed(sizeClass);
            double percent = available == 0 ? 0.0 : used * 100.0 / available;
            log.info("  {}: {}/{} slots used ({}%), {} overflow", sizeClass, used, available,
                    String.format("%.1f", percent), overflowBySize.getOrDefault(sizeClass, 0));
        }

        if (log.isDebugEnabled()) {
            SlotUsage usage = allocation.usage();
            for (String bayCode : usage.bays()) {
                Bay bay = bays.get(bayCode);
                log.debug("  {}: S {}/{}, M {}/{}, L {}/{}", bayCode,
                        usage.used(bayCode, SizeClass.SMALL), bay.available(SizeClass.SMALL),
                        usage.used(bayCode, SizeClass.MEDIUM), bay.available(SizeClass.MEDIUM),
                        usage.used(bayCode, SizeClass.LARGE), bay.available(SizeClass.LARGE));
            }
        }
    }
}
