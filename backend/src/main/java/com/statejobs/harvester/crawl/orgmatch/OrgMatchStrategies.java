package com.statejobs.harvester.crawl.orgmatch;

import com.statejobs.harvester.crawl.model.MatchStrategy;
import com.statejobs.harvester.crawl.model.OrgMatch;

import java.util.List;

final class OrgMatchStrategies {
    static final OrgMatchStrategy EXACT = (input, rules) -> {
        if (input.employer().isEmpty()) {
            return null;
        }
        for (OrgMatchRules.TagRule tag : rules.tags()) {
            if (input.employer().equals(tag.primaryName())) {
                return new OrgMatch(tag.tag(), 1.0, MatchStrategy.EXACT);
            }
        }
        return null;
    };

    static final OrgMatchStrategy SYNONYM = (input, rules) -> {
        if (input.employer().isEmpty()) {
            return null;
        }
        String padded = " " + input.employer() + " ";
        for (OrgMatchRules.TagRule tag : rules.tags()) {
            for (String synonym : tag.synonyms()) {
                if (padded.contains(" " + synonym + " ")) {
                    return new OrgMatch(tag.tag(), 1.0, MatchStrategy.SYNONYM);
                }
            }
        }
        return null;
    };

    static final OrgMatchStrategy PREFIX = (input, rules) -> {
        OrgMatchRules.TagRule tag = firstPrefixHit(input.employer(), rules.tags(), false);
        return tag == null ? null : new OrgMatch(tag.tag(), 1.0, MatchStrategy.PREFIX);
    };

    static final OrgMatchStrategy TITLE_PREFIX = (input, rules) -> {
        if (!input.sectorFilterApplied()) {
            return null;
        }
        OrgMatchRules.TagRule tag = firstPrefixHit(input.title(), rules.tags(), true);
        return tag == null ? null : new OrgMatch(tag.tag(), 1.0, MatchStrategy.TITLE_PREFIX);
    };

    static final OrgMatchStrategy FUZZY = (input, rules) -> {
        Double threshold = input.fuzzyThreshold();
        if (threshold == null || input.employer().isEmpty()) {
            return null;
        }
        OrgMatchRules.TagRule best = null;
        double bestScore = -1.0;
        for (OrgMatchRules.TagRule tag : rules.tags()) {
            for (String name : tag.names()) {
                double score = TokenSetSimilarity.score(input.employer(), name);
                if (score > bestScore) {
                    bestScore = score;
                    best = tag;
                }
            }
        }
        if (best == null || bestScore < threshold) {
            return null;
        }
        return new OrgMatch(best.tag(), bestScore, MatchStrategy.FUZZY);
    };

    static final List<OrgMatchStrategy> ORDERED = List.of(EXACT, SYNONYM, PREFIX, TITLE_PREFIX, FUZZY);

    private OrgMatchStrategies() {
    }

    private static OrgMatchRules.TagRule firstPrefixHit(
        String normalized,
        List<OrgMatchRules.TagRule> tags,
        boolean titleFallbackOnly
    ) {
        String[] tokens = OrgNameNormalizer.tokens(normalized);
        if (tokens.length == 0) {
            return null;
        }
        for (OrgMatchRules.TagRule tag : tags) {
            if (titleFallbackOnly && !tag.titleFallback()) {
                continue;
            }
            for (String prefix : tag.prefixes()) {
                for (String token : tokens) {
                    if (token.startsWith(prefix)) {
                        return tag;
                    }
                }
            }
        }
        return null;
    }
}
