package com.statejobs.harvester.crawl.service;

import com.statejobs.harvester.config.HarvesterProperties;
import com.statejobs.harvester.crawl.discovery.DiscoveryResult;
import com.statejobs.harvester.crawl.discovery.ListingDiscoveryService;
import com.statejobs.harvester.crawl.explode.RowExploder;
import com.statejobs.harvester.crawl.http.PoliteHttpClient;
import com.statejobs.harvester.crawl.jobs.DetailPageExtractor;
import com.statejobs.harvester.crawl.model.CandidateReason;
import com.statejobs.harvester.crawl.model.DetailCandidate;
import com.statejobs.harvester.crawl.model.DetailFields;
import com.statejobs.harvester.crawl.model.HarvestRunRequest;
import com.statejobs.harvester.crawl.model.HarvestRunSummary;
import com.statejobs.harvester.crawl.model.HttpFetchResult;
import com.statejobs.harvester.crawl.orgmatch.OrgMatcher;
import com.statejobs.harvester.crawl.output.HarvestOutputWriter;
import com.statejobs.harvester.crawl.robots.RobotsTxtService;
import com.statejobs.harvester.crawl.salary.DetailTextParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HarvestOrchestratorRunControlTest {
    private static final String DETAIL_URL = "https://jobs.example.no/stilling/42";

    @Mock
    private ListingDiscoveryService discoveryService;
    @Mock
    private ListingStateService stateService;
    @Mock
    private PoliteHttpClient httpClient;
    @Mock
    private RobotsTxtService robotsTxtService;
    @Mock
    private DetailPageExtractor detailPageExtractor;
    @Mock
    private DetailTextParser detailTextParser;
    @Mock
    private OrgMatcher orgMatcher;
    @Mock
    private RowExploder rowExploder;
    @Mock
    private HarvestOutputWriter outputWriter;

    private HarvesterProperties properties;
    private HarvestOrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        properties = new HarvesterProperties();
        properties.getSearch().setBaseUrl("https://jobs.example.no/sok");
        properties.getOutput().setEnabled(false);
        orchestrator = new HarvestOrchestratorService(
            properties,
            discoveryService,
            stateService,
            httpClient,
            robotsTxtService,
            detailPageExtractor,
            detailTextParser,
            orgMatcher,
            rowExploder,
            outputWriter
        );
    }

    @Test
    void secondRunIsRejectedWhileFirstIsActive() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(discoveryService.discover(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new DiscoveryResult(List.of(), 0, 0, false);
        });

        CompletableFuture<HarvestRunSummary> first = CompletableFuture.supplyAsync(
            () -> orchestrator.run(HarvestRunRequest.incremental())
        );
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(orchestrator.isRunActive()).isTrue();
        assertThatThrownBy(() -> orchestrator.run(null))
            .isInstanceOf(ActiveHarvestRunException.class)
            .hasMessageContaining("Active harvest run");

        release.countDown();
        HarvestRunSummary summary = first.get(5, TimeUnit.SECONDS);
        assertThat(summary.detailCandidates()).isZero();
        assertThat(summary.reductionRatio()).isNull();
        assertThat(orchestrator.isRunActive()).isFalse();
    }

    @Test
    void missingBaseUrlFailsBeforeDiscovery() {
        properties.getSearch().setBaseUrl(" ");

        assertThatThrownBy(() -> orchestrator.run(HarvestRunRequest.incremental()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("base-url");
        verify(discoveryService, never()).discover(any());
        assertThat(orchestrator.isRunActive()).isFalse();
    }

    @Test
    void outputFailureLeavesListingStateUntouched() {
        properties.getOutput().setEnabled(true);
        stubOneUnmatchedListing();
        when(outputWriter.write(any(), any(), any()))
            .thenThrow(new UncheckedIOException("disk full", new IOException("disk full")));

        assertThatThrownBy(() -> orchestrator.run(HarvestRunRequest.incremental()))
            .isInstanceOf(UncheckedIOException.class);
        verify(stateService, never()).recordDetailResult(any(), any(), any(), any());
        assertThat(orchestrator.isRunActive()).isFalse();
    }

    @Test
    void listingStateIsRecordedOnceOutputIsDone() {
        stubOneUnmatchedListing();

        HarvestRunSummary summary = orchestrator.run(HarvestRunRequest.incremental());

        assertThat(summary.unmatchedListings()).isEqualTo(1);
        verify(stateService, times(1)).recordDetailResult(eq("42"), eq(DETAIL_URL), any(), any());
    }

    @Test
    void cancelWaitsForActiveRunAndStopsDiscovery() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<BooleanSupplier> cancelCheck = new AtomicReference<>();
        when(discoveryService.discover(any(), any())).thenAnswer(invocation -> {
            cancelCheck.set(invocation.getArgument(1));
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new DiscoveryResult(List.of(), 0, 0, false);
        });

        CompletableFuture<HarvestRunSummary> run = CompletableFuture.supplyAsync(
            () -> orchestrator.run(HarvestRunRequest.incremental())
        );
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(cancelCheck.get().getAsBoolean()).isFalse();

        CompletableFuture<Void> cancel = CompletableFuture.runAsync(orchestrator::requestCancel);
        Thread.sleep(200);
        assertThat(cancel).isNotDone();
        assertThat(cancelCheck.get().getAsBoolean()).isTrue();

        release.countDown();
        cancel.get(5, TimeUnit.SECONDS);
        assertThat(run.get(5, TimeUnit.SECONDS).cancelled()).isTrue();
        assertThat(orchestrator.isRunActive()).isFalse();
    }

    @Test
    void awaitRunEndReturnsImmediatelyWhenIdle() {
        assertThat(orchestrator.awaitRunEnd(Duration.ofMillis(10))).isTrue();
    }

    private void stubOneUnmatchedListing() {
        when(discoveryService.discover(any(), any())).thenReturn(new DiscoveryResult(List.of(), 1, 0, false));
        when(stateService.selectDetailCandidates(false)).thenReturn(List.of(
            new DetailCandidate("42", DETAIL_URL, CandidateReason.NEVER_FETCHED, null)
        ));
        when(robotsTxtService.isAllowed(DETAIL_URL)).thenReturn(true);
        when(httpClient.get(eq(DETAIL_URL), anyString())).thenReturn(new HttpFetchResult(
            DETAIL_URL, null, 200, "<html></html>", "text/html", Instant.now(), Duration.ZERO, null, null
        ));
        when(detailPageExtractor.extract(any(), any())).thenReturn(new DetailFields(
            "Rådgiver", null, "Upstream AS", null, null, null, null, null, null, null, "", "Rådgiver Upstream AS"
        ));
        when(stateService.computeFingerprint(any())).thenReturn("fp-42");
    }
}
