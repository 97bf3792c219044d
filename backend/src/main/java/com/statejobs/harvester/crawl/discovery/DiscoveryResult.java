package com.statejobs.harvester.crawl.discovery;

import com.statejobs.harvester.crawl.model.ListingSummary;

import java.util.List;

public record DiscoveryResult(
    List<ListingSummary> summaries,
    int pagesFetched,
    int identityFailures,
    boolean stoppedOnFailure
) {
    public DiscoveryResult {
        summaries = List.copyOf(summaries);
    }
}
