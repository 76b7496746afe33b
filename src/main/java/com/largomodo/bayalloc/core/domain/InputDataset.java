package com.largomodo.bayalloc.core.domain;

import java.util.List;

/**
 * Parsed client inputs of one run. Lists are unmodifiable copies.
 */
public record InputDataset(List<LocationMasterRecord> locations, List<ArticleRecord> articles,
                           List<DemandEvent> demandEvents) {

    public InputDataset {
        locations = List.copyOf(locations);
        articles = List.copyOf(articles);
        demandEvents = List.copyOf(demandEvents);
    }
}
