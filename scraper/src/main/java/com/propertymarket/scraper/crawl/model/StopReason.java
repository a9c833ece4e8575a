package com.propertymarket.scraper.crawl.model;

public enum StopReason {
    EXHAUSTED,
    MAX_PAGES,
    FAILURE_THRESHOLD,
    SITE_UNREACHABLE,
    CANCELLED,
    DEADLINE,
    CRASHED
}
