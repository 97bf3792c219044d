package com.statejobs.harvester.crawl.model;

import java.time.Instant;

public record ListingStateView(
    String listingId,
    String sourceUrl,
    ListingLifecycle lifecycle,
    Instant firstSeenAt,
    Instant lastSeenAt,
    Instant observedUpdatedAt,
    Instant updatedAt,
    String detailFingerprint,
    Instant lastDetailAt
) {
    public static ListingStateView of(StateRecord record) {
        return new ListingStateView(
            record.listingId(),
            record.sourceUrl(),
            record.lifecycle(),
            record.firstSeenAt(),
            record.lastSeenAt(),
            record.observedUpdatedAt(),
            record.updatedAt(),
            record.detailFingerprint(),
            record.lastDetailAt()
        );
    }
}
