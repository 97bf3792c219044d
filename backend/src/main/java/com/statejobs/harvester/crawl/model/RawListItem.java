package com.statejobs.harvester.crawl.model;

import java.util.List;

public record RawListItem(
    String sourceUrl,
    List<String> idCandidates,
    String publishedAtRaw,
    String updatedAtRaw
) {
}
