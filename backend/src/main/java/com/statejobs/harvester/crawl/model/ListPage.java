package com.statejobs.harvester.crawl.model;

import java.util.List;

public record ListPage(List<RawListItem> items, String nextPageUrl) {
    public boolean hasNext() {
        return nextPageUrl != null && !nextPageUrl.isBlank();
    }
}
