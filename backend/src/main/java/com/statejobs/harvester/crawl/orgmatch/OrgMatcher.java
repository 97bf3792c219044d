package com.statejobs.harvester.crawl.orgmatch;

import com.statejobs.harvester.crawl.model.OrgMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether a listing belongs to one of the tracked organizations.
 * Strategies run in a fixed order and the first hit wins, so an exact name
 * always beats a synonym, a prefix, the title fallback and the fuzzy score.
 */
@Component
public class OrgMatcher {
    private static final Logger log = LoggerFactory.getLogger(OrgMatcher.class);

    private final OrgMatchRules rules;
    private final List<OrgMatchStrategy> strategies;

    public OrgMatcher(OrgMatchRules rules) {
        this.rules = rules;
        this.strategies = OrgMatchStrategies.ORDERED;
    }

    public OrgMatch matchOrg(String employerText, String titleText, boolean sectorFilterApplied) {
        return matchOrg(employerText, titleText, sectorFilterApplied, rules.fuzzyThreshold());
    }

    /**
     * @param fuzzyThreshold per-call override; {@code null} keeps the configured threshold
     * @return the match, or {@code null} when no strategy applies
     */
    public OrgMatch matchOrg(String employerText, String titleText, boolean sectorFilterApplied, Double fuzzyThreshold) {
        OrgMatchInput input = new OrgMatchInput(
            OrgNameNormalizer.normalize(employerText),
            OrgNameNormalizer.normalize(titleText),
            sectorFilterApplied,
            fuzzyThreshold == null ? rules.fuzzyThreshold() : fuzzyThreshold
        );
        for (OrgMatchStrategy strategy : strategies) {
            OrgMatch match = strategy.match(input, rules);
            if (match != null) {
                log.debug("Org match employer={} tag={} strategy={} confidence={}",
                    input.employer(), match.tag(), match.strategy(), match.confidence());
                return match;
            }
        }
        return null;
    }

    public static String normalizeEmployer(String employerText) {
        String normalized = OrgNameNormalizer.normalize(employerText);
        return normalized.isEmpty() ? null : normalized;
    }
}
