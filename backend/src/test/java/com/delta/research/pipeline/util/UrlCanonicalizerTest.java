package com.delta.research.pipeline.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlCanonicalizerTest {

    @Test
    void lowercasesHostDropsDefaultPortQueryAndFragment() {
        assertThat(UrlCanonicalizer.canonicalize("HTTPS://Example.COM:443//About//Team/?utm=1#top"))
            .isEqualTo("https://example.com/About/Team");
    }

    @Test
    void addsSchemeAndRootPath() {
        assertThat(UrlCanonicalizer.canonicalize("  example.org ")).isEqualTo("http://example.org/");
        assertThat(UrlCanonicalizer.canonicalize("http://example.org:8080")).isEqualTo("http://example.org:8080/");
    }

    @Test
    void rejectsUnusableUrls() {
        assertThatThrownBy(() -> UrlCanonicalizer.canonicalize(" ")).hasMessage("empty_url");
        assertThatThrownBy(() -> UrlCanonicalizer.canonicalize("ftp://example.org/file")).hasMessage("invalid_url");
        assertThatThrownBy(() -> UrlCanonicalizer.canonicalize("http:///nohost")).hasMessage("invalid_host");
        assertThat(UrlCanonicalizer.isValid("http://bad host/")).isFalse();
    }
}
