package com.propertymarket.scraper.crawl.model;

public record RunMetrics(
    long elapsedMs,
    long peakMemoryBytes,
    long memoryDeltaBytes,
    int requestCount,
    int attemptCount,
    int cacheHitCount,
    int pagesFetched,
    int parseSkipCount,
    int rawListingCount,
    int duplicateCount
) {
}
