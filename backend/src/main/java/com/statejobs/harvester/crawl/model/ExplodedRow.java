package com.statejobs.harvester.crawl.model;

import java.time.Instant;

public record ExplodedRow(
    String listingId,
    String jobCode,
    String jobTitle,
    String employerNormalized,
    Long salaryMin,
    Long salaryMax,
    String salaryText,
    boolean sharedSalary,
    Instant publishedAt,
    Instant updatedAt,
    Instant applyDeadline,
    String sourceUrl,
    Instant scrapedAt,
    String matchedOrgTag,
    Double matchConfidence,
    MatchStrategy matchStrategy
) {
    public RowKey key() {
        return new RowKey(listingId, jobCode);
    }

    public boolean hasBounds() {
        return salaryMin != null || salaryMax != null;
    }

    public record RowKey(String listingId, String jobCode) {
    }
}
