package com.statejobs.harvester.crawl.model;

public record HarvestRunRequest(
    boolean fullRefresh,
    Integer maxPages,
    Double fuzzyThreshold
) {
    public static HarvestRunRequest incremental() {
        return new HarvestRunRequest(false, null, null);
    }
}
