package com.statejobs.harvester.crawl.orgmatch;

import com.statejobs.harvester.config.HarvesterProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, pre-normalized view of the configured organization tags.
 */
public record OrgMatchRules(List<TagRule> tags, Double fuzzyThreshold) {
    public OrgMatchRules {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static OrgMatchRules from(List<HarvesterProperties.OrgTag> orgs, Double fuzzyThreshold) {
        List<TagRule> rules = new ArrayList<>();
        if (orgs != null) {
            for (HarvesterProperties.OrgTag org : orgs) {
                if (org.getTag() == null || org.getTag().isBlank()) {
                    continue;
                }
                String primary = org.getPrimaryName() == null ? org.getTag() : org.getPrimaryName();
                rules.add(new TagRule(
                    org.getTag().trim(),
                    OrgNameNormalizer.normalize(primary),
                    normalizeAll(org.getSynonyms()),
                    normalizeAll(org.getPrefixes()),
                    org.isTitleFallback()
                ));
            }
        }
        return new OrgMatchRules(rules, fuzzyThreshold);
    }

    private static List<String> normalizeAll(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) {
            return out;
        }
        for (String value : values) {
            String normalized = OrgNameNormalizer.normalize(value);
            if (!normalized.isEmpty() && !out.contains(normalized)) {
                out.add(normalized);
            }
        }
        return out;
    }

    public record TagRule(
        String tag,
        String primaryName,
        List<String> synonyms,
        List<String> prefixes,
        boolean titleFallback
    ) {
        public TagRule {
            synonyms = List.copyOf(synonyms);
            prefixes = List.copyOf(prefixes);
        }

        public List<String> names() {
            List<String> names = new ArrayList<>();
            if (!primaryName.isEmpty()) {
                names.add(primaryName);
            }
            for (String synonym : synonyms) {
                if (!names.contains(synonym)) {
                    names.add(synonym);
                }
            }
            return names;
        }
    }
}
