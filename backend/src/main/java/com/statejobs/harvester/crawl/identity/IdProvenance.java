package com.statejobs.harvester.crawl.identity;

public enum IdProvenance {
    NATIVE_ATTRIBUTE,
    URL_UUID,
    URL_NUMERIC,
    URL_QUERY,
    URL_HASH
}
