package com.statejobs.harvester.crawl.model;

import java.time.Instant;

public record DetailCandidate(
    String listingId,
    String sourceUrl,
    CandidateReason reason,
    Instant observedUpdatedAt
) {
}
