package com.statejobs.harvester.crawl.identity;

import com.statejobs.harvester.crawl.util.HashUtils;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListingIdResolverTest {
    private final ListingIdResolver resolver = new ListingIdResolver(IdentityRules.defaults());

    @Test
    void nativeAttributeWinsOverUrl() {
        ResolvedListingId id = resolver.resolveId(
            Arrays.asList(null, " ", "abc-42"),
            "https://jobs.example.no/stilling/123456"
        );

        assertThat(id.listingId()).isEqualTo("abc-42");
        assertThat(id.provenance()).isEqualTo(IdProvenance.NATIVE_ATTRIBUTE);
    }

    @Test
    void uuidInUrlIsLowercased() {
        ResolvedListingId id = resolver.resolveId(
            List.of(),
            "https://jobs.example.no/stilling/3F2504E0-4F89-11D3-9A0C-0305E82C3301?page=2"
        );

        assertThat(id.listingId()).isEqualTo("3f2504e0-4f89-11d3-9a0c-0305e82c3301");
        assertThat(id.provenance()).isEqualTo(IdProvenance.URL_UUID);
    }

    @Test
    void sixDigitPathNumberIsUsed() {
        ResolvedListingId id = resolver.resolveId(null, "https://jobs.example.no/stilling/2024/987654-radgiver");

        assertThat(id.listingId()).isEqualTo("987654");
        assertThat(id.provenance()).isEqualTo(IdProvenance.URL_NUMERIC);
    }

    @Test
    void shortNumbersFallThroughToQueryKeys() {
        ResolvedListingId id = resolver.resolveId(null, "https://jobs.example.no/stilling/2024?jobId=A%2077");

        assertThat(id.listingId()).isEqualTo("A 77");
        assertThat(id.provenance()).isEqualTo(IdProvenance.URL_QUERY);
    }

    @Test
    void hashOfCanonicalUrlIsLastResort() {
        String url = "https://jobs.example.no/stilling/radgiver";
        ResolvedListingId id = resolver.resolveId(null, url);

        assertThat(id.provenance()).isEqualTo(IdProvenance.URL_HASH);
        assertThat(id.listingId()).isEqualTo(HashUtils.sha256Hex(url));
    }

    @Test
    void hashIsStableAcrossTrackingAndOrderingNoise() {
        ResolvedListingId first = resolver.resolveId(
            null,
            "https://Jobs.Example.no:443/stilling/radgiver/?b=2&a=1&utm_source=mail#apply"
        );
        ResolvedListingId second = resolver.resolveId(
            null,
            "https://jobs.example.no/stilling/radgiver?a=1&gclid=xyz&b=2"
        );

        assertThat(first.listingId()).isEqualTo(second.listingId());
    }

    @Test
    void missingIdAndUrlIsAnIdentityError() {
        assertThatThrownBy(() -> resolver.resolveId(List.of(""), null))
            .isInstanceOf(IdentityException.class);
        assertThatThrownBy(() -> resolver.resolveId(null, "/relative/path"))
            .isInstanceOf(IdentityException.class);
    }

    @Test
    void resolvingIsDeterministic() {
        String url = "https://jobs.example.no/stilling?title=r%C3%A5dgiver";
        assertThat(resolver.resolveId(null, url)).isEqualTo(resolver.resolveId(null, url));
    }
}
