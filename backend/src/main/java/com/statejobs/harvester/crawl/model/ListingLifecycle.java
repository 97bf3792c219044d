package com.statejobs.harvester.crawl.model;

public enum ListingLifecycle {
    SUMMARY_SEEN,
    DETAIL_FETCHED,
    STALE
}
