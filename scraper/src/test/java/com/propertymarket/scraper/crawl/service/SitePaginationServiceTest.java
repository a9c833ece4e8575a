package com.propertymarket.scraper.crawl.service;

import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.extract.MagicBricksExtractor;
import com.propertymarket.scraper.crawl.http.FetchResultCache;
import com.propertymarket.scraper.crawl.model.FetchRequest;
import com.propertymarket.scraper.crawl.model.FetchResult;
import com.propertymarket.scraper.crawl.model.FetchStatus;
import com.propertymarket.scraper.crawl.model.ScrapeErrorType;
import com.propertymarket.scraper.crawl.model.SiteScrapeResult;
import com.propertymarket.scraper.crawl.model.StopReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SitePaginationServiceTest {
    private static final String BASE = "https://www.magicbricks.com/ready-to-move-flats-in-pune-pppfs";

    @Mock
    private PageFetcher pageFetcher;

    private ScraperProperties properties;
    private MagicBricksExtractor extractor;
    private ScrapeRunContext context;
    private final List<FetchRequest> fetched = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new ScraperProperties();
        properties.getPagination().setMaxPagesPerSite(5);
        properties.getPagination().setMaxConsecutiveFailures(2);
        extractor = new MagicBricksExtractor(properties);
        context = new ScrapeRunContext("pune", new FetchResultCache(), null);
    }

    @Test
    void followsNextPointersUntilExhausted() {
        respond(request -> request.page() < 3
            ? ok(request, page(card("Flat " + request.page() + " in Baner"), BASE + "?page=" + (request.page() + 1)))
            : ok(request, page(card("Flat 3 in Baner"), null)));

        SiteScrapeResult result = service().scrape(extractor, context);

        assertThat(result.summary().stopReason()).isEqualTo(StopReason.EXHAUSTED);
        assertThat(result.summary().pagesFetched()).isEqualTo(3);
        assertThat(result.listings()).hasSize(3);
        assertThat(result.errors()).isEmpty();
        assertThat(fetched).extracting(FetchRequest::page).containsExactly(1, 2, 3);
    }

    @Test
    void stopsAtPageLimit() {
        properties.getPagination().setMaxPagesPerSite(2);
        respond(request -> ok(request, page(card("Flat in Baner"), BASE + "?page=" + (request.page() + 1))));

        SiteScrapeResult result = service().scrape(extractor, context);

        assertThat(result.summary().stopReason()).isEqualTo(StopReason.MAX_PAGES);
        assertThat(fetched).hasSize(2);
    }

    @Test
    void firstPageFailureMarksSiteUnreachable() {
        respond(request -> failed(request, 503));

        SiteScrapeResult result = service().scrape(extractor, context);

        assertThat(result.summary().stopReason()).isEqualTo(StopReason.SITE_UNREACHABLE);
        assertThat(result.summary().pagesFetched()).isZero();
        assertThat(result.summary().pagesFailed()).isEqualTo(1);
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.type()).isEqualTo(ScrapeErrorType.HTTP_ERROR);
            assertThat(error.httpStatus()).isEqualTo(503);
        });
    }

    @Test
    void laterFailureSkipsAheadUntilThreshold() {
        respond(request -> request.page() == 1
            ? ok(request, page(card("Flat in Baner"), BASE + "?page=2"))
            : failed(request, 500));

        SiteScrapeResult result = service().scrape(extractor, context);

        assertThat(result.summary().stopReason()).isEqualTo(StopReason.FAILURE_THRESHOLD);
        assertThat(fetched).extracting(FetchRequest::page).containsExactly(1, 2, 3);
        assertThat(result.errors()).hasSize(2);
        assertThat(result.listings()).hasSize(1);
    }

    @Test
    void skippedPageRecoversWhenNextPageSucceeds() {
        respond(request -> switch (request.page()) {
            case 1 -> ok(request, page(card("Flat A in Baner"), BASE + "?page=2"));
            case 2 -> failed(request, 502);
            default -> ok(request, page(card("Flat C in Baner"), null));
        });

        SiteScrapeResult result = service().scrape(extractor, context);

        assertThat(result.summary().stopReason()).isEqualTo(StopReason.EXHAUSTED);
        assertThat(result.listings()).hasSize(2);
        assertThat(result.errors()).hasSize(1);
        assertThat(fetched.get(2).url()).isEqualTo(BASE + "?page=3");
    }

    @Test
    void emptyPagesCountTowardsThreshold() {
        respond(request -> ok(request, page("", BASE + "?page=" + (request.page() + 1))));

        SiteScrapeResult result = service().scrape(extractor, context);

        assertThat(result.summary().stopReason()).isEqualTo(StopReason.FAILURE_THRESHOLD);
        assertThat(fetched).hasSize(2);
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void repeatedNextPointerEndsTheWalk() {
        respond(request -> ok(request, page(card("Flat in Baner"), BASE + "?page=2")));

        SiteScrapeResult result = service().scrape(extractor, context);

        assertThat(result.summary().stopReason()).isEqualTo(StopReason.EXHAUSTED);
        assertThat(fetched).hasSize(2);
    }

    @Test
    void cancelledRunFetchesNothing() {
        context.cancel();

        SiteScrapeResult result = service().scrape(extractor, context);

        assertThat(result.summary().stopReason()).isEqualTo(StopReason.CANCELLED);
        verify(pageFetcher, never()).fetch(any(), any());
    }

    @Test
    void expiredDeadlineFetchesNothing() {
        ScrapeRunContext expired = new ScrapeRunContext("pune", new FetchResultCache(), Instant.now().minusSeconds(1));

        SiteScrapeResult result = service().scrape(extractor, expired);

        assertThat(result.summary().stopReason()).isEqualTo(StopReason.DEADLINE);
        verify(pageFetcher, never()).fetch(any(), any());
    }

    private SitePaginationService service() {
        return new SitePaginationService(pageFetcher, properties);
    }

    private void respond(Function<FetchRequest, FetchResult> responder) {
        when(pageFetcher.fetch(any(), any())).thenAnswer(invocation -> {
            FetchRequest request = invocation.getArgument(0);
            fetched.add(request);
            return responder.apply(request);
        });
    }

    private static String card(String title) {
        return """
            <div class="mb-srp__card">
              <h2 class="mb-srp__card--title">%s</h2>
              <div class="mb-srp__card__price--amount">₹45 Lac</div>
            </div>
            """.formatted(title);
    }

    private static String page(String cards, String nextUrl) {
        String next = nextUrl == null ? "" : "<a class=\"mb-pagination__list--next\" href=\"" + nextUrl + "\">Next</a>";
        return "<html><body>" + cards + next + "</body></html>";
    }

    private static FetchResult ok(FetchRequest request, String body) {
        return new FetchResult(request, FetchStatus.OK, 200, body, "text/html", Instant.now(), Duration.ZERO, 1, null, null);
    }

    private static FetchResult failed(FetchRequest request, int status) {
        return new FetchResult(request, FetchStatus.HTTP_ERROR, status, null, null, Instant.now(), Duration.ZERO, 3, "http_" + status, null);
    }
}
