package com.propertymarket.scraper.crawl.model;

public record SiteScrapeSummary(
    SiteId site,
    int pagesFetched,
    int pagesFailed,
    int rawListingCount,
    int parseSkipCount,
    StopReason stopReason
) {
    public static SiteScrapeSummary crashed(SiteId site) {
        return new SiteScrapeSummary(site, 0, 0, 0, 0, StopReason.CRASHED);
    }
}
