package com.largomodo.bayalloc.core.domain;

/**
 * Traceability entry for one raw location code.
 *
 * @param location    resolved location
 * @param inLocations code appears in the location master
 * @param inArticles  code is referenced as an article pick location
 * @param inPicks     code is referenced by at least one demand event
 * @param pickCount   number of demand events referencing the code
 */
public record LocationAudit(Location location, boolean inLocations, boolean inArticles, boolean inPicks,
                            int pickCount) {
}
