package com.statejobs.harvester.crawl.model;

import com.statejobs.harvester.crawl.identity.IdProvenance;

import java.time.Instant;

public record ListingSummary(
    String listingId,
    String sourceUrl,
    Instant publishedAt,
    Instant updatedAt,
    IdProvenance idProvenance
) {
}
