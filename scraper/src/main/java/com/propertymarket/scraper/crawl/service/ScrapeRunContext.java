package com.propertymarket.scraper.crawl.service;

import com.propertymarket.scraper.crawl.http.FetchResultCache;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State shared by every site driver of one run: the fetch cache, request counters,
 * the cancellation flag and the optional deadline.
 */
public class ScrapeRunContext {
    private final String city;
    private final FetchResultCache cache;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger requestCount = new AtomicInteger();
    private final AtomicInteger attemptCount = new AtomicInteger();
    private final AtomicInteger cacheHitCount = new AtomicInteger();

    public ScrapeRunContext(String city, FetchResultCache cache, Instant deadline) {
        this.city = city;
        this.cache = cache;
        this.deadline = deadline;
    }

    public String city() {
        return city;
    }

    public FetchResultCache cache() {
        return cache;
    }

    public Instant deadline() {
        return deadline;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isPastDeadline() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    void recordNetworkFetch(int attempts) {
        requestCount.incrementAndGet();
        attemptCount.addAndGet(Math.max(1, attempts));
    }

    void recordCacheHit() {
        cacheHitCount.incrementAndGet();
    }

    public int requestCount() {
        return requestCount.get();
    }

    public int attemptCount() {
        return attemptCount.get();
    }

    public int cacheHitCount() {
        return cacheHitCount.get();
    }
}
