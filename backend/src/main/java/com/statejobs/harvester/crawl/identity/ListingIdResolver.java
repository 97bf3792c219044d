package com.statejobs.harvester.crawl.identity;

import com.statejobs.harvester.crawl.util.HashUtils;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the stable listing identifier. Rules are tried in order: a native id
 * attribute, a UUID in the URL, a 6+ digit id in the URL path, a known id query
 * parameter and finally a SHA-256 of the canonical URL.
 */
@Component
public class ListingIdResolver {
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}"
    );
    private static final Pattern NUMERIC_ID_PATTERN = Pattern.compile("(?<!\\d)\\d{6,}(?!\\d)");

    private final IdentityRules rules;
    private final UrlCanonicalizer canonicalizer;

    public ListingIdResolver(IdentityRules rules) {
        this.rules = rules;
        this.canonicalizer = new UrlCanonicalizer(rules);
    }

    public ResolvedListingId resolveId(List<String> candidateAttributes, String sourceUrl) {
        if (candidateAttributes != null) {
            for (String candidate : candidateAttributes) {
                if (candidate != null && !candidate.isBlank()) {
                    return new ResolvedListingId(candidate.trim(), IdProvenance.NATIVE_ATTRIBUTE);
                }
            }
        }
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IdentityException("no native id and no source URL");
        }
        String canonical = canonicalizer.canonicalize(sourceUrl);
        URI uri = UrlCanonicalizer.parse(canonical);

        Matcher uuid = UUID_PATTERN.matcher(canonical);
        if (uuid.find()) {
            return new ResolvedListingId(uuid.group().toLowerCase(Locale.ROOT), IdProvenance.URL_UUID);
        }
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        Matcher numeric = NUMERIC_ID_PATTERN.matcher(path);
        if (numeric.find()) {
            return new ResolvedListingId(numeric.group(), IdProvenance.URL_NUMERIC);
        }
        Map<String, String> query = queryParams(uri.getRawQuery());
        for (String key : rules.queryIdKeys()) {
            String value = query.get(key);
            if (value != null && !value.isBlank()) {
                return new ResolvedListingId(value.trim(), IdProvenance.URL_QUERY);
            }
        }
        return new ResolvedListingId(HashUtils.sha256Hex(canonical), IdProvenance.URL_HASH);
    }

    private static Map<String, String> queryParams(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            params.putIfAbsent(key, value);
        }
        return params;
    }
}
