package com.propertymarket.scraper.crawl.model;

import java.util.List;

public record AggregationResult(
    List<NormalizedListing> listings,
    List<ScrapeError> dataQualityErrors,
    int duplicateCount
) {
    public AggregationResult {
        listings = List.copyOf(listings);
        dataQualityErrors = List.copyOf(dataQualityErrors);
    }
}
