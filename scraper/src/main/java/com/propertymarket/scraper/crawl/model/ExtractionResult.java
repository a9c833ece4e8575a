package com.propertymarket.scraper.crawl.model;

import java.util.List;
import java.util.Optional;

public record ExtractionResult(
    List<RawListing> listings,
    Optional<FetchRequest> nextPage,
    int parseSkips,
    String fault
) {
    public ExtractionResult {
        listings = List.copyOf(listings);
        nextPage = nextPage == null ? Optional.empty() : nextPage;
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), Optional.empty(), 0, null);
    }

    public static ExtractionResult fault(String message) {
        return new ExtractionResult(List.of(), Optional.empty(), 0, message);
    }

    public boolean isFault() {
        return fault != null;
    }
}
