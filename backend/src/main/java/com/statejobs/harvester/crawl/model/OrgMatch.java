package com.statejobs.harvester.crawl.model;

public record OrgMatch(String tag, double confidence, MatchStrategy strategy) {
}
