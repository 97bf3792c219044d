package com.statejobs.harvester.crawl.orgmatch;

public record OrgMatchInput(
    String employer,
    String title,
    boolean sectorFilterApplied,
    Double fuzzyThreshold
) {
}
