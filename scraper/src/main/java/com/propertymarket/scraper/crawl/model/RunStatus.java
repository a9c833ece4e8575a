package com.propertymarket.scraper.crawl.model;

public enum RunStatus {
    COMPLETED,
    FAILED
}
