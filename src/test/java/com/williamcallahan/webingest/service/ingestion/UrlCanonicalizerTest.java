package com.williamcallahan.webingest.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Verifies the canonical URL policy used for identity and lookups.
 */
class UrlCanonicalizerTest {

    private final UrlCanonicalizer canonicalizer = new UrlCanonicalizer();

    @Test
    void stripsTrackingParametersAndFragment() {
        assertEquals("http://a.com/x", canonicalizer.canonicalize("http://a.com/x?utm=1"));
        assertEquals("https://example.com/post?id=7",
            canonicalizer.canonicalize("https://example.com/post?utm_source=news&id=7&fbclid=abc#comments"));
    }

    @Test
    void keepsParametersThatOnlyStartWithUtmLetters() {
        assertEquals("https://example.com/list?utmost=3&sort=asc",
            canonicalizer.canonicalize("https://example.com/list?utmost=3&utm_campaign=spring&sort=asc"));
    }

    @Test
    void keepsRemainingParametersInOriginalOrder() {
        assertEquals("https://example.com/search?q=java&page=2",
            canonicalizer.canonicalize("https://example.com/search?q=java&gclid=x&page=2"));
    }

    @Test
    void lowercasesSchemeAndHostButNotPath() {
        assertEquals("https://example.com/Docs/Guide",
            canonicalizer.canonicalize("HTTPS://Example.COM/Docs/Guide"));
    }

    @Test
    void dropsDefaultPortsAndUserInfo() {
        assertEquals("http://example.com/", canonicalizer.canonicalize("http://user:pw@example.com:80"));
        assertEquals("https://example.com:8443/a", canonicalizer.canonicalize("https://example.com:8443/a"));
    }

    @Test
    void blankInputHasNoCanonicalForm() {
        assertNull(canonicalizer.canonicalize("   "));
        assertNull(canonicalizer.canonicalize(null));
    }

    @Test
    void nonAbsoluteInputIsReturnedTrimmed() {
        assertEquals("not a url", canonicalizer.canonicalize("  not a url "));
        assertEquals("/relative/path", canonicalizer.canonicalize("/relative/path"));
    }

    @Test
    void canonicalizationIsIdempotent() {
        String once = canonicalizer.canonicalize("https://Example.com/a?utm_medium=x&b=1#top");

        assertEquals(once, canonicalizer.canonicalize(once));
    }

    @Test
    void recognizesWebUrls() {
        assertTrue(canonicalizer.isWebUrl("http://x/"));
        assertFalse(canonicalizer.isWebUrl("ftp://files.example.com/a"));
        assertFalse(canonicalizer.isWebUrl("not a url"));
        assertFalse(canonicalizer.isWebUrl(null));
    }
}
