package com.statejobs.harvester.crawl.model;

public enum CandidateReason {
    FULL_REFRESH,
    NEVER_FETCHED,
    UPDATED_AT_CHANGED,
    FINGERPRINT_CHANGED
}
