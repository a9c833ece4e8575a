package com.propertymarket.scraper.crawl.model;

import java.util.List;

public record SiteScrapeResult(
    SiteScrapeSummary summary,
    List<RawListing> listings,
    List<ScrapeError> errors
) {
    public SiteScrapeResult {
        listings = List.copyOf(listings);
        errors = List.copyOf(errors);
    }
}
