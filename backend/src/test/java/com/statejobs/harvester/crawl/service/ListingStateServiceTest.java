package com.statejobs.harvester.crawl.service;

import com.statejobs.harvester.crawl.identity.IdProvenance;
import com.statejobs.harvester.crawl.model.CandidateReason;
import com.statejobs.harvester.crawl.model.DetailCandidate;
import com.statejobs.harvester.crawl.model.ListingSummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ListingStateServiceTest {
    private static final Instant UPDATED = Instant.parse("2024-05-01T00:00:00Z");

    @Autowired
    private ListingStateService stateService;

    @Test
    void newListingsAreNeverFetchedCandidates() {
        stateService.upsertSummary(summary("S-1", UPDATED));
        stateService.upsertSummary(summary("S-2", null));

        List<DetailCandidate> candidates = stateService.selectDetailCandidates(false);

        assertThat(candidates).extracting(DetailCandidate::listingId).containsExactly("S-1", "S-2");
        assertThat(candidates).extracting(DetailCandidate::reason).containsOnly(CandidateReason.NEVER_FETCHED);
        assertThat(candidates.get(0).observedUpdatedAt()).isEqualTo(UPDATED);
    }

    @Test
    void secondRunWithoutChangesSelectsNothing() {
        stateService.upsertSummary(summary("S-3", UPDATED));
        for (DetailCandidate candidate : stateService.selectDetailCandidates(false)) {
            stateService.recordDetailResult(
                candidate.listingId(),
                candidate.sourceUrl(),
                stateService.computeFingerprint("body"),
                candidate.observedUpdatedAt()
            );
        }

        stateService.upsertSummary(summary("S-3", UPDATED));

        assertThat(stateService.selectDetailCandidates(false)).isEmpty();
    }

    @Test
    void changedUpdateTimeSelectsListingAgain() {
        stateService.upsertSummary(summary("S-4", UPDATED));
        stateService.recordDetailResult("S-4", null, "fp", UPDATED);
        stateService.upsertSummary(summary("S-4", UPDATED.plusSeconds(3600)));

        assertThat(stateService.selectDetailCandidates(false))
            .singleElement()
            .satisfies(candidate -> {
                assertThat(candidate.listingId()).isEqualTo("S-4");
                assertThat(candidate.reason()).isEqualTo(CandidateReason.UPDATED_AT_CHANGED);
            });
    }

    @Test
    void fingerprintMismatchSelectsListing() {
        stateService.upsertSummary(summary("S-5", UPDATED));
        stateService.recordDetailResult("S-5", null, "fp-old", UPDATED);

        assertThat(stateService.selectDetailCandidates(false, Map.of("S-5", "fp-old"))).isEmpty();
        assertThat(stateService.selectDetailCandidates(false, Map.of("S-5", "fp-new")))
            .extracting(DetailCandidate::reason)
            .containsExactly(CandidateReason.FINGERPRINT_CHANGED);
    }

    @Test
    void fullRefreshSelectsEverything() {
        stateService.upsertSummary(summary("S-6", UPDATED));
        stateService.recordDetailResult("S-6", null, "fp", UPDATED);
        stateService.upsertSummary(summary("S-7", UPDATED));

        assertThat(stateService.selectDetailCandidates(true))
            .extracting(DetailCandidate::reason)
            .containsOnly(CandidateReason.FULL_REFRESH)
            .hasSize(2);
        assertThat(stateService.countListings()).isEqualTo(2);
    }

    @Test
    void blankIdsAreIgnored() {
        stateService.upsertSummary(summary(" ", UPDATED));
        stateService.upsertSummary(null);

        assertThat(stateService.countListings()).isZero();
    }

    @Test
    void fingerprintIgnoresWhitespaceNoise() {
        assertThat(stateService.computeFingerprint("Lønn  kr\n650 000"))
            .isEqualTo(stateService.computeFingerprint("Lønn kr 650 000"));
        assertThat(stateService.computeFingerprint("a")).hasSize(64);
    }

    private static ListingSummary summary(String id, Instant updatedAt) {
        return new ListingSummary(id, "https://jobs.example.no/stilling/" + id, null, updatedAt, IdProvenance.URL_QUERY);
    }
}
