package com.statejobs.harvester.crawl.api;

public record HarvestApiRunRequest(
    Boolean fullRefresh,
    Integer maxPages,
    Double fuzzyThreshold
) {
}
