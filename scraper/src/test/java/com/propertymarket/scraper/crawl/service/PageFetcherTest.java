package com.propertymarket.scraper.crawl.service;

import com.propertymarket.scraper.crawl.http.FetchResultCache;
import com.propertymarket.scraper.crawl.http.PoliteHttpClient;
import com.propertymarket.scraper.crawl.model.FetchRequest;
import com.propertymarket.scraper.crawl.model.FetchResult;
import com.propertymarket.scraper.crawl.model.FetchStatus;
import com.propertymarket.scraper.crawl.model.SiteId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageFetcherTest {

    @Mock
    private PoliteHttpClient httpClient;

    @Test
    void equivalentUrlsHitTheNetworkOnce() {
        when(httpClient.fetch(any())).thenAnswer(invocation -> ok(invocation.getArgument(0), 1));
        PageFetcher fetcher = new PageFetcher(httpClient);
        ScrapeRunContext context = new ScrapeRunContext("pune", new FetchResultCache(), null);

        FetchResult first = fetcher.fetch(
            new FetchRequest("https://www.MakaAn.com/pune?b=2&a=1", SiteId.MAKAAN, 1),
            context
        );
        FetchResult second = fetcher.fetch(
            new FetchRequest("https://www.makaan.com:443/pune?a=1&b=2#results", SiteId.MAKAAN, 1),
            context
        );

        assertThat(second).isSameAs(first);
        verify(httpClient, times(1)).fetch(any());
        assertThat(context.requestCount()).isEqualTo(1);
        assertThat(context.cacheHitCount()).isEqualTo(1);
    }

    @Test
    void countsEveryAttemptOfANetworkFetch() {
        when(httpClient.fetch(any())).thenAnswer(invocation -> failed(invocation.getArgument(0), 3));
        PageFetcher fetcher = new PageFetcher(httpClient);
        ScrapeRunContext context = new ScrapeRunContext("pune", new FetchResultCache(), null);

        FetchRequest request = new FetchRequest("https://www.makaan.com/pune", SiteId.MAKAAN, 1);
        fetcher.fetch(request, context);
        fetcher.fetch(request, context);

        assertThat(context.requestCount()).isEqualTo(2);
        assertThat(context.attemptCount()).isEqualTo(6);
        assertThat(context.cacheHitCount()).isZero();
    }

    @Test
    void unexpectedClientFailureBecomesNetworkError() {
        when(httpClient.fetch(any())).thenThrow(new IllegalStateException("executor shut down"));
        PageFetcher fetcher = new PageFetcher(httpClient);
        ScrapeRunContext context = new ScrapeRunContext("pune", new FetchResultCache(), null);

        FetchResult result = fetcher.fetch(new FetchRequest("https://www.makaan.com/pune", SiteId.MAKAAN, 1), context);

        assertThat(result.status()).isEqualTo(FetchStatus.NETWORK_ERROR);
        assertThat(result.errorCode()).isEqualTo("fetch_exception");
        assertThat(result.errorMessage()).contains("executor shut down");
    }

    private static FetchResult ok(FetchRequest request, int attempts) {
        return new FetchResult(request, FetchStatus.OK, 200, "<html></html>", "text/html", Instant.now(), Duration.ZERO, attempts, null, null);
    }

    private static FetchResult failed(FetchRequest request, int attempts) {
        return new FetchResult(request, FetchStatus.HTTP_ERROR, 503, null, null, Instant.now(), Duration.ZERO, attempts, "http_503", null);
    }
}
