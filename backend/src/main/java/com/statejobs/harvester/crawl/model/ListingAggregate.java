package com.statejobs.harvester.crawl.model;

import java.time.Instant;

public record ListingAggregate(
    String listingId,
    String title,
    String jobTitle,
    String employerRaw,
    String employerNormalized,
    String matchedOrgTag,
    Double matchConfidence,
    MatchStrategy matchStrategy,
    String locations,
    String employmentType,
    String extent,
    Instant publishedAt,
    Instant updatedAt,
    Instant applyDeadline,
    String sourceUrl,
    int jobCodeCount,
    Instant scrapedAt
) {
    public static ListingAggregate of(DetailRecord detail, OrgMatch match, Instant scrapedAt) {
        return new ListingAggregate(
            detail.listingId(),
            detail.title(),
            detail.jobTitle(),
            detail.employerRaw(),
            detail.employerNormalized(),
            match == null ? null : match.tag(),
            match == null ? null : match.confidence(),
            match == null ? null : match.strategy(),
            detail.locations(),
            detail.employmentType(),
            detail.extent(),
            detail.publishedAt(),
            detail.updatedAt(),
            detail.applyDeadline(),
            detail.sourceUrl(),
            (int) detail.jobCodes().stream().map(JobCodeEntry::code).distinct().count(),
            scrapedAt
        );
    }
}
