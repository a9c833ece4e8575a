package com.propertymarket.scraper.crawl.service;

import com.propertymarket.scraper.crawl.http.FetchResultCache;
import com.propertymarket.scraper.crawl.http.PoliteHttpClient;
import com.propertymarket.scraper.crawl.model.FetchRequest;
import com.propertymarket.scraper.crawl.model.FetchResult;
import com.propertymarket.scraper.crawl.model.FetchStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final PoliteHttpClient httpClient;

    public PageFetcher(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Returns the page through the run cache. Never throws; failures are encoded in the result status.
     */
    public FetchResult fetch(FetchRequest request, ScrapeRunContext context) {
        Instant startedAt = Instant.now();
        try {
            FetchResultCache.Lookup lookup = context.cache().getOrLoad(request.cacheKey(), () -> {
                FetchResult loaded = httpClient.fetch(request);
                context.recordNetworkFetch(loaded.attempts());
                return loaded;
            });
            if (lookup.fromCache()) {
                context.recordCacheHit();
                log.debug("cache hit site={} url={} status={}", request.site().key(), request.url(), lookup.result().status());
            }
            return lookup.result();
        } catch (RuntimeException e) {
            log.warn("fetch failed unexpectedly site={} url={}", request.site().key(), request.url(), e);
            return new FetchResult(
                request,
                FetchStatus.NETWORK_ERROR,
                0,
                null,
                null,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                1,
                "fetch_exception",
                e.getClass().getSimpleName() + ": " + e.getMessage()
            );
        }
    }
}
