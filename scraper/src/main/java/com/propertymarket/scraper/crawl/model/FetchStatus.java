package com.propertymarket.scraper.crawl.model;

public enum FetchStatus {
    OK,
    HTTP_ERROR,
    NETWORK_ERROR,
    TIMEOUT
}
