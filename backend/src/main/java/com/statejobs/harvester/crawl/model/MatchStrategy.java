package com.statejobs.harvester.crawl.model;

public enum MatchStrategy {
    EXACT,
    SYNONYM,
    PREFIX,
    TITLE_PREFIX,
    FUZZY
}
