package com.propertymarket.scraper.crawl.model;

import com.propertymarket.scraper.crawl.util.UrlUtils;

import java.util.Objects;

public record FetchRequest(String url, SiteId site, int page) {
    public FetchRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(site, "site");
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1 but was " + page);
        }
    }

    public String cacheKey() {
        return UrlUtils.normalizeForKey(url);
    }
}
