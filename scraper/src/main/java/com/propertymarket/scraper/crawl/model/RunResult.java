package com.propertymarket.scraper.crawl.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record RunResult(
    String city,
    RunStatus status,
    boolean cancelled,
    Set<SiteId> sitesScraped,
    List<NormalizedListing> listings,
    List<ScrapeError> errors,
    List<SiteScrapeSummary> siteSummaries,
    RunMetrics metrics,
    Instant startedAt,
    Instant finishedAt
) {
    public RunResult {
        sitesScraped = Collections.unmodifiableSet(new LinkedHashSet<>(sitesScraped));
        listings = List.copyOf(listings);
        errors = List.copyOf(errors);
        siteSummaries = List.copyOf(siteSummaries);
    }

    public boolean isSuccessful() {
        return status == RunStatus.COMPLETED;
    }

    public long errorCount(ScrapeErrorType type) {
        return errors.stream().filter(error -> error.type() == type).count();
    }
}
