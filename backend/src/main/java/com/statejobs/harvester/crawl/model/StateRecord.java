package com.statejobs.harvester.crawl.model;

import java.time.Instant;

public record StateRecord(
    String listingId,
    String sourceUrl,
    Instant firstSeenAt,
    Instant lastSeenAt,
    Instant observedUpdatedAt,
    Instant updatedAt,
    String detailFingerprint,
    Instant lastDetailAt
) {
    public ListingLifecycle lifecycle() {
        if (detailFingerprint == null) {
            return ListingLifecycle.SUMMARY_SEEN;
        }
        if (observedUpdatedAt != null && !observedUpdatedAt.equals(updatedAt)) {
            return ListingLifecycle.STALE;
        }
        return ListingLifecycle.DETAIL_FETCHED;
    }
}
