package com.statejobs.harvester.crawl.service;

import com.statejobs.harvester.crawl.model.CandidateReason;
import com.statejobs.harvester.crawl.model.DetailCandidate;
import com.statejobs.harvester.crawl.model.ListingSummary;
import com.statejobs.harvester.crawl.model.StateRecord;
import com.statejobs.harvester.crawl.persistence.ListingStateRepository;
import com.statejobs.harvester.crawl.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tracks listings across runs and decides which of them need a detail fetch.
 */
@Service
public class ListingStateService {
    private static final Logger log = LoggerFactory.getLogger(ListingStateService.class);

    private final ListingStateRepository repository;

    public ListingStateService(ListingStateRepository repository) {
        this.repository = repository;
    }

    public void upsertSummary(ListingSummary summary) {
        if (summary == null || summary.listingId() == null || summary.listingId().isBlank()) {
            return;
        }
        repository.upsertSummary(summary, Instant.now());
    }

    public List<DetailCandidate> selectDetailCandidates(boolean fullRefresh) {
        return selectDetailCandidates(fullRefresh, Map.of());
    }

    /**
     * @param freshFingerprints cheap fingerprints the caller already has, keyed by
     *                          listing id; a mismatch with the stored one selects
     *                          the listing even when its update time is unchanged
     */
    public List<DetailCandidate> selectDetailCandidates(boolean fullRefresh, Map<String, String> freshFingerprints) {
        if (fullRefresh) {
            List<DetailCandidate> all = new ArrayList<>();
            for (StateRecord record : repository.findAll()) {
                all.add(toCandidate(record, CandidateReason.FULL_REFRESH));
            }
            log.info("Detail candidates mode=full_refresh count={}", all.size());
            return all;
        }

        List<StateRecord> records = freshFingerprints == null || freshFingerprints.isEmpty()
            ? repository.findIncrementalCandidates()
            : repository.findAll();
        List<DetailCandidate> candidates = new ArrayList<>();
        for (StateRecord record : records) {
            CandidateReason reason = reasonFor(record, freshFingerprints);
            if (reason != null) {
                candidates.add(toCandidate(record, reason));
            }
        }
        log.info("Detail candidates mode=incremental count={}", candidates.size());
        return candidates;
    }

    public String computeFingerprint(String normalizedDetailContent) {
        return HashUtils.sha256Hex(HashUtils.collapseWhitespace(normalizedDetailContent));
    }

    public void recordDetailResult(String listingId, String sourceUrl, String fingerprint, Instant updatedAt) {
        repository.recordDetailResult(listingId, sourceUrl, fingerprint, updatedAt, Instant.now());
    }

    public long countListings() {
        return repository.countListings();
    }

    static CandidateReason reasonFor(StateRecord record, Map<String, String> freshFingerprints) {
        if (record.detailFingerprint() == null) {
            return CandidateReason.NEVER_FETCHED;
        }
        if (record.observedUpdatedAt() != null && !record.observedUpdatedAt().equals(record.updatedAt())) {
            return CandidateReason.UPDATED_AT_CHANGED;
        }
        if (freshFingerprints != null) {
            String fresh = freshFingerprints.get(record.listingId());
            if (fresh != null && !fresh.equals(record.detailFingerprint())) {
                return CandidateReason.FINGERPRINT_CHANGED;
            }
        }
        return null;
    }

    private DetailCandidate toCandidate(StateRecord record, CandidateReason reason) {
        return new DetailCandidate(record.listingId(), record.sourceUrl(), reason, record.observedUpdatedAt());
    }
}
