package com.statejobs.harvester.crawl.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity,
    boolean runActive,
    Map<String, Long> counts
) {
}
