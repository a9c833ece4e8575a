package com.propertymarket.scraper.crawl.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class UrlUtilsTest {

    @Test
    void normalizeForKeyCanonicalizesEquivalentUrls() {
        String expected = "https://www.magicbricks.com/flats-in-pune?a=1&page=2";
        assertEquals(expected, UrlUtils.normalizeForKey("HTTPS://WWW.MagicBricks.com:443/flats-in-pune?page=2&a=1#top"));
        assertEquals(expected, UrlUtils.normalizeForKey("https://www.magicbricks.com/flats-in-pune?a=1&page=2"));
        assertEquals("http://localhost:8080/", UrlUtils.normalizeForKey("http://localhost:8080"));
    }

    @Test
    void withQueryParamKeepsExistingQueryAndFragment() {
        assertEquals("https://x.test/a?page=2", UrlUtils.withQueryParam("https://x.test/a", "page", "2"));
        assertEquals("https://x.test/a?q=1&page=3#r", UrlUtils.withQueryParam("https://x.test/a?q=1#r", "page", "3"));
    }

    @Test
    void resolveHandlesRelativeAndRejectsScriptLinks() {
        assertEquals("https://x.test/mb/pune?page=2", UrlUtils.resolve("https://x.test/mb/pune", "/mb/pune?page=2"));
        assertEquals("https://y.test/z", UrlUtils.resolve("https://x.test/mb/pune", "https://y.test/z"));
        assertNull(UrlUtils.resolve("https://x.test/", "javascript:void(0)"));
        assertNull(UrlUtils.resolve("https://x.test/", "#top"));
    }

    @Test
    void citySlugLowercasesAndHyphenates() {
        assertEquals("navi-mumbai", UrlUtils.citySlug("  Navi   Mumbai "));
        assertEquals("", UrlUtils.citySlug(null));
    }

    @Test
    void sha256IsStableLowercaseHex() {
        assertEquals(
            "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
            HashUtils.sha256Hex("")
        );
    }
}
