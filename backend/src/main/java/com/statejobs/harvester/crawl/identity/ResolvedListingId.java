package com.statejobs.harvester.crawl.identity;

public record ResolvedListingId(String listingId, IdProvenance provenance) {
}
