package com.statejobs.harvester.crawl.discovery;

import com.statejobs.harvester.config.HarvesterProperties;
import com.statejobs.harvester.crawl.http.PoliteHttpClient;
import com.statejobs.harvester.crawl.identity.IdentityException;
import com.statejobs.harvester.crawl.identity.ListingIdResolver;
import com.statejobs.harvester.crawl.identity.ResolvedListingId;
import com.statejobs.harvester.crawl.model.HttpFetchResult;
import com.statejobs.harvester.crawl.model.ListPage;
import com.statejobs.harvester.crawl.model.ListingSummary;
import com.statejobs.harvester.crawl.model.RawListItem;
import com.statejobs.harvester.crawl.robots.RobotsTxtService;
import com.statejobs.harvester.crawl.util.DateNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Walks the result pages and turns every list item into a listing summary.
 * Pagination stops at the page limit, on an empty page, when a configured
 * next-page link is missing, or when a page cannot be fetched.
 */
@Service
public class ListingDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(ListingDiscoveryService.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";

    private final HarvesterProperties properties;
    private final SearchUrlBuilder searchUrlBuilder;
    private final ListPageExtractor listPageExtractor;
    private final ListingIdResolver listingIdResolver;
    private final PoliteHttpClient httpClient;
    private final RobotsTxtService robotsTxtService;

    public ListingDiscoveryService(
        HarvesterProperties properties,
        SearchUrlBuilder searchUrlBuilder,
        ListPageExtractor listPageExtractor,
        ListingIdResolver listingIdResolver,
        PoliteHttpClient httpClient,
        RobotsTxtService robotsTxtService
    ) {
        this.properties = properties;
        this.searchUrlBuilder = searchUrlBuilder;
        this.listPageExtractor = listPageExtractor;
        this.listingIdResolver = listingIdResolver;
        this.httpClient = httpClient;
        this.robotsTxtService = robotsTxtService;
    }

    public DiscoveryResult discover(Integer maxPagesOverride) {
        return discover(maxPagesOverride, () -> false);
    }

    /**
     * Walks the result pages; {@code cancelled} is checked before every page.
     */
    public DiscoveryResult discover(Integer maxPagesOverride, BooleanSupplier cancelled) {
        HarvesterProperties.Search search = properties.getSearch();
        int maxPages = maxPagesOverride != null && maxPagesOverride > 0 ? maxPagesOverride : search.getMaxPages();
        boolean followNextLinks = properties.getListSelectors().getNextPage() != null
            && !properties.getListSelectors().getNextPage().isBlank();

        Map<String, ListingSummary> summaries = new LinkedHashMap<>();
        int pagesFetched = 0;
        int identityFailures = 0;
        boolean stoppedOnFailure = false;
        int page = search.getStartPage();
        String url = searchUrlBuilder.build(page);

        while (pagesFetched < maxPages && url != null) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                log.info("Discovery cancelled page={} pagesFetched={}", page, pagesFetched);
                break;
            }
            if (!robotsTxtService.isAllowed(url)) {
                log.warn("Discovery blocked by robots url={}", url);
                stoppedOnFailure = true;
                break;
            }
            HttpFetchResult fetch = httpClient.get(url, HTML_ACCEPT);
            if (fetch == null || !fetch.isSuccessful()) {
                log.warn(
                    "List page fetch failed page={} url={} status={} errorCode={}",
                    page,
                    url,
                    fetch == null ? null : fetch.statusCode(),
                    fetch == null ? null : fetch.errorCode()
                );
                stoppedOnFailure = true;
                break;
            }
            pagesFetched++;

            ListPage listPage = listPageExtractor.extract(fetch.body(), fetch.finalUrlOrRequested());
            if (listPage.items().isEmpty()) {
                log.info("Empty result page page={} url={}", page, url);
                break;
            }
            int added = 0;
            for (RawListItem item : listPage.items()) {
                try {
                    ListingSummary summary = toSummary(item);
                    if (summaries.putIfAbsent(summary.listingId(), summary) == null) {
                        added++;
                    }
                } catch (IdentityException e) {
                    identityFailures++;
                    log.warn("Skipping list item without identity url={} reason={}", item.sourceUrl(), e.getMessage());
                }
            }
            log.info("Discovered page={} items={} new={} total={}", page, listPage.items().size(), added, summaries.size());

            if (followNextLinks) {
                url = listPage.hasNext() ? listPage.nextPageUrl() : null;
                page++;
            } else {
                page++;
                url = searchUrlBuilder.build(page);
            }
        }
        return new DiscoveryResult(new ArrayList<>(summaries.values()), pagesFetched, identityFailures, stoppedOnFailure);
    }

    ListingSummary toSummary(RawListItem item) {
        ResolvedListingId resolved = listingIdResolver.resolveId(item.idCandidates(), item.sourceUrl());
        return new ListingSummary(
            resolved.listingId(),
            item.sourceUrl(),
            DateNormalizer.toInstant(item.publishedAtRaw()),
            DateNormalizer.toInstant(item.updatedAtRaw()),
            resolved.provenance()
        );
    }
}
