package com.propertymarket.scraper.crawl.model;

public enum ScrapeErrorType {
    NETWORK_ERROR,
    TIMEOUT,
    HTTP_ERROR,
    PARSE_FAULT,
    DATA_QUALITY,
    SITE_FAILURE,
    RUN_FAILURE;

    public static ScrapeErrorType fromFetchStatus(FetchStatus status) {
        return switch (status) {
            case TIMEOUT -> TIMEOUT;
            case HTTP_ERROR -> HTTP_ERROR;
            case NETWORK_ERROR, OK -> NETWORK_ERROR;
        };
    }
}
