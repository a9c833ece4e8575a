package com.propertymarket.scraper.crawl.model;

import java.time.Instant;

public record ScrapeError(
    ScrapeErrorType type,
    SiteId site,
    String url,
    Integer httpStatus,
    String message,
    Instant occurredAt
) {
    public static ScrapeError fetchFailure(FetchResult result) {
        FetchRequest request = result.request();
        String message = result.errorMessage();
        if (message == null || message.isBlank()) {
            message = result.status() == FetchStatus.HTTP_ERROR
                ? "HTTP " + result.httpStatus()
                : result.errorCode();
        }
        return new ScrapeError(
            ScrapeErrorType.fromFetchStatus(result.status()),
            request.site(),
            request.url(),
            result.httpStatus() > 0 ? result.httpStatus() : null,
            message,
            Instant.now()
        );
    }

    public static ScrapeError parseFault(FetchRequest request, String message) {
        return new ScrapeError(ScrapeErrorType.PARSE_FAULT, request.site(), request.url(), null, message, Instant.now());
    }

    public static ScrapeError dataQuality(RawListing listing, String message) {
        return new ScrapeError(ScrapeErrorType.DATA_QUALITY, listing.site(), listing.sourceUrl(), null, message, Instant.now());
    }

    public static ScrapeError siteFailure(SiteId site, String message) {
        return new ScrapeError(ScrapeErrorType.SITE_FAILURE, site, null, null, message, Instant.now());
    }

    public static ScrapeError runFailure(String message) {
        return new ScrapeError(ScrapeErrorType.RUN_FAILURE, null, null, null, message, Instant.now());
    }
}
