package com.statejobs.harvester.crawl.identity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UrlCanonicalizerTest {
    private final UrlCanonicalizer canonicalizer = new UrlCanonicalizer(IdentityRules.defaults());

    @Test
    void lowercasesSchemeAndHostAndDropsDefaultPort() {
        assertEquals(
            "https://jobs.example.no/Stilling/Radgiver",
            canonicalizer.canonicalize("HTTPS://JOBS.Example.NO:443/Stilling/Radgiver")
        );
        assertEquals(
            "http://jobs.example.no:8080/a",
            canonicalizer.canonicalize("http://jobs.example.no:8080/a/")
        );
    }

    @Test
    void dropsFragmentTrackingParamsAndSortsQuery() {
        assertEquals(
            "https://jobs.example.no/a?id=7&page=2",
            canonicalizer.canonicalize("https://jobs.example.no/a?utm_campaign=x&page=2&fbclid=1&id=7#top")
        );
    }

    @Test
    void rootPathCanonicalizesToHostOnly() {
        assertEquals("https://jobs.example.no", canonicalizer.canonicalize("https://jobs.example.no/"));
    }

    @Test
    void rejectsMalformedUrls() {
        assertThrows(IdentityException.class, () -> canonicalizer.canonicalize("https://exa mple.no/a"));
        assertThrows(IdentityException.class, () -> canonicalizer.canonicalize("   "));
    }
}
