package com.statejobs.harvester.crawl.discovery;

import com.statejobs.harvester.config.HarvesterProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Builds result-page URLs carrying the sector filter, the open-only filter,
 * the page number, an optional free-text query and any extra site parameters.
 */
@Component
public class SearchUrlBuilder {
    private final HarvesterProperties properties;

    public SearchUrlBuilder(HarvesterProperties properties) {
        this.properties = properties;
    }

    public String build(int page) {
        HarvesterProperties.Search search = properties.getSearch();
        String baseUrl = search.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("harvester.search.base-url must be configured");
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl.trim());
        if (search.isSectorFilterApplied()) {
            builder.replaceQueryParam(search.getSectorParam(), search.getSectorValue());
        }
        builder.replaceQueryParam(search.getOpenOnlyParam(), search.isOpenOnly() ? "true" : "false");
        builder.replaceQueryParam(search.getPageParam(), Math.max(1, page));
        if (search.getQuery() != null && !search.getQuery().isBlank()) {
            builder.replaceQueryParam(search.getQueryParam(), search.getQuery().trim());
        }
        for (Map.Entry<String, String> extra : search.getExtraParams().entrySet()) {
            builder.replaceQueryParam(extra.getKey(), extra.getValue());
        }
        return builder.encode().build().toUriString();
    }
}
