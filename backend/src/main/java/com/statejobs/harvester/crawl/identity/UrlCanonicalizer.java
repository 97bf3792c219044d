package com.statejobs.harvester.crawl.identity;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Produces the canonical form of a listing URL used for hashing and comparison.
 * Two URLs that only differ by fragment, tracking parameters, parameter order,
 * default port, host case or trailing slashes canonicalize to the same string.
 */
public final class UrlCanonicalizer {
    private final IdentityRules rules;

    public UrlCanonicalizer(IdentityRules rules) {
        this.rules = rules;
    }

    public String canonicalize(String url) {
        URI uri = parse(url);
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port < 0
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);

        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(host);
        if (!defaultPort) {
            out.append(':').append(port);
        }
        out.append(stripTrailingSlashes(uri.getRawPath()));

        String query = canonicalQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    public static URI parse(String url) {
        if (url == null || url.isBlank()) {
            throw new IdentityException("listing URL is blank");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IdentityException("listing URL is malformed: " + url, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IdentityException("listing URL must be absolute: " + url);
        }
        return uri;
    }

    private String canonicalQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        List<Map.Entry<String, String>> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            if (rules.isTrackingParam(key)) {
                continue;
            }
            kept.add(Map.entry(key, value));
        }
        kept.sort(Comparator.<Map.Entry<String, String>, String>comparing(Map.Entry::getKey)
            .thenComparing(Map.Entry::getValue));
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, String> entry : kept) {
            if (out.length() > 0) {
                out.append('&');
            }
            out.append(entry.getKey()).append('=').append(entry.getValue());
        }
        return out.toString();
    }

    private static String stripTrailingSlashes(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String trimmed = path;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return "/".equals(trimmed) ? "" : trimmed;
    }
}
