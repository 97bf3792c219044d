package com.statejobs.harvester.crawl.identity;

import com.statejobs.harvester.config.HarvesterProperties;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record IdentityRules(
    List<String> queryIdKeys,
    Set<String> trackingParams,
    List<String> trackingParamPrefixes
) {
    public IdentityRules {
        queryIdKeys = queryIdKeys == null ? List.of() : List.copyOf(queryIdKeys);
        trackingParams = trackingParams == null ? Set.of() : Set.copyOf(trackingParams);
        trackingParamPrefixes = trackingParamPrefixes == null ? List.of() : List.copyOf(trackingParamPrefixes);
    }

    public static IdentityRules from(HarvesterProperties.Identity identity) {
        return new IdentityRules(
            identity.getQueryIdKeys(),
            identity.getTrackingParams().stream()
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet()),
            identity.getTrackingParamPrefixes().stream()
                .map(value -> value.toLowerCase(Locale.ROOT))
                .toList()
        );
    }

    public static IdentityRules defaults() {
        return from(new HarvesterProperties.Identity());
    }

    public boolean isTrackingParam(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        if (trackingParams.contains(lower)) {
            return true;
        }
        for (String prefix : trackingParamPrefixes) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
