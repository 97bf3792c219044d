package com.statejobs.harvester.crawl.service;

import com.statejobs.harvester.config.HarvesterProperties;
import com.statejobs.harvester.crawl.discovery.DiscoveryResult;
import com.statejobs.harvester.crawl.discovery.ListingDiscoveryService;
import com.statejobs.harvester.crawl.explode.ExplodedRowSet;
import com.statejobs.harvester.crawl.explode.RowExploder;
import com.statejobs.harvester.crawl.http.PoliteHttpClient;
import com.statejobs.harvester.crawl.jobs.DetailPageExtractor;
import com.statejobs.harvester.crawl.model.DetailCandidate;
import com.statejobs.harvester.crawl.model.DetailFields;
import com.statejobs.harvester.crawl.model.DetailRecord;
import com.statejobs.harvester.crawl.model.ExplodedRow;
import com.statejobs.harvester.crawl.model.ExplodedRowMetrics;
import com.statejobs.harvester.crawl.model.HarvestRunRequest;
import com.statejobs.harvester.crawl.model.HarvestRunSummary;
import com.statejobs.harvester.crawl.model.HttpFetchResult;
import com.statejobs.harvester.crawl.model.ListingAggregate;
import com.statejobs.harvester.crawl.model.ListingSummary;
import com.statejobs.harvester.crawl.model.OrgMatch;
import com.statejobs.harvester.crawl.model.ParsedDetail;
import com.statejobs.harvester.crawl.orgmatch.OrgMatcher;
import com.statejobs.harvester.crawl.output.HarvestOutputWriter;
import com.statejobs.harvester.crawl.output.OutputFiles;
import com.statejobs.harvester.crawl.robots.RobotsTxtService;
import com.statejobs.harvester.crawl.salary.DetailTextParser;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one harvest: discovery, state update, candidate selection, detail fetch,
 * parsing, org matching, explosion and output. One run at a time.
 *
 * <p>Detail results (fingerprint, updated-at) are written to listing state only
 * after the output files are written, so a run whose output fails selects the
 * same listings again next time.
 */
@Service
public class HarvestOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(HarvestOrchestratorService.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    private static final Duration CANCEL_WAIT = Duration.ofSeconds(30);

    private final HarvesterProperties properties;
    private final ListingDiscoveryService discoveryService;
    private final ListingStateService stateService;
    private final PoliteHttpClient httpClient;
    private final RobotsTxtService robotsTxtService;
    private final DetailPageExtractor detailPageExtractor;
    private final DetailTextParser detailTextParser;
    private final OrgMatcher orgMatcher;
    private final RowExploder rowExploder;
    private final HarvestOutputWriter outputWriter;

    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public HarvestOrchestratorService(
        HarvesterProperties properties,
        ListingDiscoveryService discoveryService,
        ListingStateService stateService,
        PoliteHttpClient httpClient,
        RobotsTxtService robotsTxtService,
        DetailPageExtractor detailPageExtractor,
        DetailTextParser detailTextParser,
        OrgMatcher orgMatcher,
        RowExploder rowExploder,
        HarvestOutputWriter outputWriter
    ) {
        this.properties = properties;
        this.discoveryService = discoveryService;
        this.stateService = stateService;
        this.httpClient = httpClient;
        this.robotsTxtService = robotsTxtService;
        this.detailPageExtractor = detailPageExtractor;
        this.detailTextParser = detailTextParser;
        this.orgMatcher = orgMatcher;
        this.rowExploder = rowExploder;
        this.outputWriter = outputWriter;
    }

    public HarvestRunSummary run(HarvestRunRequest request) {
        HarvestRunRequest effective = request == null ? HarvestRunRequest.incremental() : request;
        if (!runLock.tryLock()) {
            throw new ActiveHarvestRunException("Active harvest run in progress");
        }
        try {
            cancelRequested.set(false);
            return runLocked(effective);
        } finally {
            runLock.unlock();
        }
    }

    public boolean isRunActive() {
        return runLock.isLocked();
    }

    @PreDestroy
    public void requestCancel() {
        cancelRequested.set(true);
        if (!runLock.isLocked() || runLock.isHeldByCurrentThread()) {
            return;
        }
        log.info("Harvest cancellation requested; waiting for the current listing");
        awaitRunEnd(CANCEL_WAIT);
    }

    /**
     * Blocks until no run holds the lock, or the timeout passes.
     */
    boolean awaitRunEnd(Duration timeout) {
        try {
            if (runLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                runLock.unlock();
                return true;
            }
            log.warn("Harvest still running after cancellation timeoutMs={}", timeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HarvestRunSummary runLocked(HarvestRunRequest request) {
        String baseUrl = properties.getSearch().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("harvester.search.base-url must be configured");
        }
        Instant startedAt = Instant.now();
        log.info(
            "Harvest started mode={} maxPages={} fuzzyThreshold={}",
            request.fullRefresh() ? "full_refresh" : "incremental",
            request.maxPages(),
            request.fuzzyThreshold()
        );

        DiscoveryResult discovery = discoveryService.discover(request.maxPages(), cancelRequested::get);
        for (ListingSummary summary : discovery.summaries()) {
            stateService.upsertSummary(summary);
        }
        int knownListings = (int) stateService.countListings();

        List<DetailCandidate> candidates = stateService.selectDetailCandidates(request.fullRefresh());
        boolean sectorFilterApplied = properties.getSearch().isSectorFilterApplied();

        ExplodedRowSet rowSet = new ExplodedRowSet();
        List<ListingAggregate> listings = new ArrayList<>();
        List<PendingState> pendingStates = new ArrayList<>();
        int detailsFetched = 0;
        int detailFailures = 0;
        int unmatched = 0;
        boolean cancelled = cancelRequested.get();

        for (DetailCandidate candidate : candidates) {
            if (cancelRequested.get() || Thread.currentThread().isInterrupted()) {
                cancelled = true;
                log.warn("Harvest cancelled processed={} remaining={}", detailsFetched + detailFailures,
                    candidates.size() - detailsFetched - detailFailures);
                break;
            }
            try {
                DetailOutcome outcome = processCandidate(
                    candidate,
                    request,
                    sectorFilterApplied,
                    rowSet,
                    listings,
                    pendingStates
                );
                switch (outcome) {
                    case FAILED -> detailFailures++;
                    case UNMATCHED -> {
                        detailsFetched++;
                        unmatched++;
                    }
                    default -> detailsFetched++;
                }
            } catch (RuntimeException e) {
                detailFailures++;
                log.warn("Detail processing failed listingId={} url={}", candidate.listingId(), candidate.sourceUrl(), e);
            }
        }

        List<ExplodedRow> rows = rowSet.rows();
        String explodedPath = null;
        String listingsPath = null;
        if (properties.getOutput().isEnabled()) {
            OutputFiles files = outputWriter.write(rows, listings, startedAt);
            explodedPath = files.explodedCsv().toString();
            listingsPath = files.listingsCsv().toString();
        }
        for (PendingState state : pendingStates) {
            stateService.recordDetailResult(state.listingId(), state.url(), state.fingerprint(), state.updatedAt());
        }

        ExplodedRowMetrics metrics = ExplodedRowMetrics.compute(rows);
        HarvestRunSummary summary = new HarvestRunSummary(
            startedAt,
            Instant.now(),
            request.fullRefresh(),
            discovery.pagesFetched(),
            discovery.summaries().size(),
            knownListings,
            candidates.size(),
            detailsFetched,
            detailFailures,
            unmatched,
            rows.size(),
            cancelled,
            explodedPath,
            listingsPath,
            metrics
        );
        log.info(
            "Harvest finished pages={} discovered={} known={} candidates={} fetched={} failures={} unmatched={} rows={} "
                + "codes_pct={} salary_any_pct={} reduction_ratio={} merged_duplicates={}",
            summary.pagesFetched(),
            summary.listingsDiscovered(),
            summary.knownListings(),
            summary.detailCandidates(),
            summary.detailsFetched(),
            summary.detailFailures(),
            summary.unmatchedListings(),
            summary.rowsProduced(),
            metrics.codesPct(),
            metrics.salaryAnyPct(),
            summary.reductionRatio(),
            rowSet.mergedDuplicates()
        );
        return summary;
    }

    private DetailOutcome processCandidate(
        DetailCandidate candidate,
        HarvestRunRequest request,
        boolean sectorFilterApplied,
        ExplodedRowSet rowSet,
        List<ListingAggregate> listings,
        List<PendingState> pendingStates
    ) {
        String url = candidate.sourceUrl();
        if (url == null || url.isBlank()) {
            log.warn("Skipping candidate without source url listingId={}", candidate.listingId());
            return DetailOutcome.FAILED;
        }
        if (!robotsTxtService.isAllowed(url)) {
            return DetailOutcome.FAILED;
        }
        Duration crawlDelay = robotsTxtService.crawlDelay(url);
        if (crawlDelay != null && !crawlDelay.isZero()) {
            httpClient.deferHost(url, crawlDelay);
        }

        HttpFetchResult fetch = httpClient.get(url, HTML_ACCEPT);
        if (!fetch.isSuccessful()) {
            log.warn(
                "Detail fetch failed listingId={} url={} status={} error={} kind={}",
                candidate.listingId(),
                url,
                fetch.statusCode(),
                fetch.errorCode(),
                fetch.failureKind()
            );
            return DetailOutcome.FAILED;
        }

        DetailFields fields = detailPageExtractor.extract(fetch.body(), fetch.finalUrlOrRequested());
        if (fields == null) {
            log.warn("Detail page empty listingId={} url={}", candidate.listingId(), url);
            return DetailOutcome.FAILED;
        }
        Instant scrapedAt = Instant.now();
        String fingerprint = stateService.computeFingerprint(fields.contentText());
        Instant updatedAt = candidate.observedUpdatedAt() != null ? candidate.observedUpdatedAt() : fields.updatedAt();

        OrgMatch match = orgMatcher.matchOrg(
            fields.employerRaw(),
            fields.title(),
            sectorFilterApplied,
            request.fuzzyThreshold()
        );
        if (match == null && properties.getMatching().isDropUnmatched()) {
            log.info(
                "Listing unmatched listingId={} employer={} title={}",
                candidate.listingId(),
                fields.employerRaw(),
                fields.title()
            );
            pendingStates.add(new PendingState(candidate.listingId(), url, fingerprint, updatedAt));
            return DetailOutcome.UNMATCHED;
        }

        ParsedDetail parsed = detailTextParser.parseDetail(fields.rawDetailText());
        DetailRecord detail = new DetailRecord(
            candidate.listingId(),
            url,
            fields.title(),
            fields.jobTitle(),
            fields.employerRaw(),
            OrgMatcher.normalizeEmployer(fields.employerRaw()),
            fields.locations(),
            fields.employmentType(),
            fields.extent(),
            fields.publishedAt(),
            fields.updatedAt(),
            fields.applyDeadline(),
            parsed.listingSalary(),
            parsed.codes()
        );
        rowSet.addAll(rowExploder.explode(detail, match, scrapedAt));
        listings.add(ListingAggregate.of(detail, match, scrapedAt));
        pendingStates.add(new PendingState(candidate.listingId(), url, fingerprint, updatedAt));
        log.debug(
            "Listing processed listingId={} codes={} tag={} reason={}",
            candidate.listingId(),
            detail.jobCodes().size(),
            match == null ? null : match.tag(),
            candidate.reason()
        );
        return match == null ? DetailOutcome.UNMATCHED : DetailOutcome.PROCESSED;
    }

    private record PendingState(String listingId, String url, String fingerprint, Instant updatedAt) {
    }

    private enum DetailOutcome {
        PROCESSED,
        UNMATCHED,
        FAILED
    }
}
