package com.propertymarket.scraper.crawl.extract;

import com.propertymarket.scraper.crawl.model.ExtractionResult;
import com.propertymarket.scraper.crawl.model.FetchRequest;
import com.propertymarket.scraper.crawl.model.FetchResult;
import com.propertymarket.scraper.crawl.model.SiteId;

/**
 * Turns one fetched search-results page of a single site into raw listings and the next
 * page to visit. There is exactly one implementation per {@link SiteId}.
 */
public sealed interface SiteExtractor permits AbstractSiteExtractor {

    SiteId site();

    /**
     * Search page request for {@code city}; page 1 is the site's landing search URL.
     */
    FetchRequest searchRequest(String city, int page);

    /**
     * Never throws. Non-OK or empty pages and unexpected markup give an empty result
     * without a next page.
     */
    ExtractionResult extract(FetchResult result);
}
