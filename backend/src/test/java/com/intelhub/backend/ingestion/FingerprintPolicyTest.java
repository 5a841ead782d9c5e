package com.intelhub.backend.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FingerprintPolicyTest {

    private final FingerprintPolicy policy = new FingerprintPolicy();

    @Test
    void canonicalizeUrl_shouldDropTrackingParamsAndSortQuery() {
        String canonical = policy.canonicalizeUrl(
                "HTTPS://News.Example.com:443/world/story/?utm_source=rss&b=2&fbclid=xyz&a=1");

        assertThat(canonical).isEqualTo("https://news.example.com/world/story?a=1&b=2");
    }

    @Test
    void canonicalizeUrl_shouldKeepNonDefaultPort() {
        assertThat(policy.canonicalizeUrl("http://example.com:8080/a"))
                .isEqualTo("http://example.com:8080/a");
    }

    @Test
    void canonicalizeUrl_shouldReturnNull_whenNotHttpUrl() {
        assertThat(policy.canonicalizeUrl(null)).isNull();
        assertThat(policy.canonicalizeUrl("  ")).isNull();
        assertThat(policy.canonicalizeUrl("ftp://example.com/file")).isNull();
        assertThat(policy.canonicalizeUrl("not a url")).isNull();
    }

    @Test
    void fingerprint_shouldMatch_whenUrlsDifferOnlyInTrackingNoise() {
        String first = policy.fingerprint("https://example.com/a?id=7&utm_campaign=x", "body one");
        String second = policy.fingerprint("https://EXAMPLE.com/a/?id=7", "a completely different body");

        assertThat(first).isEqualTo(second).hasSize(64);
    }

    @Test
    void fingerprint_shouldFallBackToContent_whenUrlMissing() {
        String first = policy.fingerprint(null, "  Breaking   News\n about  X ");
        String second = policy.fingerprint("", "breaking news about x");
        String other = policy.fingerprint(null, "breaking news about y");

        assertThat(first).isEqualTo(second);
        assertThat(first).isNotEqualTo(other);
    }

    @Test
    void fingerprint_shouldDifferBetweenUrlAndContentNamespaces() {
        assertThat(policy.fingerprint("https://example.com/a", "x"))
                .isNotEqualTo(policy.fingerprint(null, "https://example.com/a"));
    }
}
