package com.statejobs.harvester.crawl.model;

import java.time.Instant;

public record HarvestRunSummary(
    Instant startedAt,
    Instant finishedAt,
    boolean fullRefresh,
    int pagesFetched,
    int listingsDiscovered,
    int knownListings,
    int detailCandidates,
    int detailsFetched,
    int detailFailures,
    int unmatchedListings,
    int rowsProduced,
    boolean cancelled,
    String explodedOutputPath,
    String listingsOutputPath,
    ExplodedRowMetrics metrics
) {
    /**
     * Share of known listings that did not need a detail fetch this run.
     */
    public Double reductionRatio() {
        if (knownListings <= 0) {
            return null;
        }
        return 1.0 - ((double) detailCandidates / knownListings);
    }
}
