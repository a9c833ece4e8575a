package com.propertymarket.scraper.crawl.service;

import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.extract.SiteExtractor;
import com.propertymarket.scraper.crawl.model.ExtractionResult;
import com.propertymarket.scraper.crawl.model.FetchRequest;
import com.propertymarket.scraper.crawl.model.FetchResult;
import com.propertymarket.scraper.crawl.model.RawListing;
import com.propertymarket.scraper.crawl.model.ScrapeError;
import com.propertymarket.scraper.crawl.model.SiteId;
import com.propertymarket.scraper.crawl.model.SiteScrapeResult;
import com.propertymarket.scraper.crawl.model.SiteScrapeSummary;
import com.propertymarket.scraper.crawl.model.StopReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks one site's search result pages strictly in order until the site runs out of pages
 * or a stop condition hits.
 */
@Service
public class SitePaginationService {
    private static final Logger log = LoggerFactory.getLogger(SitePaginationService.class);

    private final PageFetcher pageFetcher;
    private final ScraperProperties properties;

    public SitePaginationService(PageFetcher pageFetcher, ScraperProperties properties) {
        this.pageFetcher = pageFetcher;
        this.properties = properties;
    }

    public SiteScrapeResult scrape(SiteExtractor extractor, ScrapeRunContext context) {
        SiteId site = extractor.site();
        int maxPages = properties.getPagination().getMaxPagesPerSite();
        int maxConsecutiveFailures = properties.getPagination().getMaxConsecutiveFailures();

        List<RawListing> listings = new ArrayList<>();
        List<ScrapeError> errors = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        int pagesVisited = 0;
        int pagesFetched = 0;
        int pagesFailed = 0;
        int parseSkips = 0;
        int consecutiveFailures = 0;
        StopReason stopReason;

        FetchRequest next = extractor.searchRequest(context.city(), 1);
        log.info("Scraping site={} city={} start={}", site.key(), context.city(), next.url());
        while (true) {
            if (context.isCancelled()) {
                stopReason = StopReason.CANCELLED;
                break;
            }
            if (context.isPastDeadline()) {
                stopReason = StopReason.DEADLINE;
                break;
            }
            if (pagesVisited >= maxPages) {
                stopReason = StopReason.MAX_PAGES;
                break;
            }
            if (!visited.add(next.cacheKey())) {
                stopReason = StopReason.EXHAUSTED;
                break;
            }
            pagesVisited++;

            FetchRequest current = next;
            FetchResult result = pageFetcher.fetch(current, context);
            if (!result.isOk()) {
                pagesFailed++;
                consecutiveFailures++;
                errors.add(ScrapeError.fetchFailure(result));
                if (current.page() == 1) {
                    stopReason = StopReason.SITE_UNREACHABLE;
                    break;
                }
                if (consecutiveFailures >= maxConsecutiveFailures) {
                    stopReason = StopReason.FAILURE_THRESHOLD;
                    break;
                }
                next = extractor.searchRequest(context.city(), current.page() + 1);
                continue;
            }

            pagesFetched++;
            ExtractionResult extraction = extractor.extract(result);
            parseSkips += extraction.parseSkips();
            listings.addAll(extraction.listings());
            if (extraction.isFault()) {
                pagesFailed++;
                consecutiveFailures++;
                errors.add(ScrapeError.parseFault(current, extraction.fault()));
                if (consecutiveFailures >= maxConsecutiveFailures) {
                    stopReason = StopReason.FAILURE_THRESHOLD;
                    break;
                }
                next = extractor.searchRequest(context.city(), current.page() + 1);
                continue;
            }
            if (extraction.listings().isEmpty()) {
                consecutiveFailures++;
            } else {
                consecutiveFailures = 0;
            }
            log.debug(
                "page site={} page={} listings={} skipped={} hasNext={}",
                site.key(),
                current.page(),
                extraction.listings().size(),
                extraction.parseSkips(),
                extraction.nextPage().isPresent()
            );
            if (extraction.nextPage().isEmpty()) {
                stopReason = StopReason.EXHAUSTED;
                break;
            }
            if (consecutiveFailures >= maxConsecutiveFailures) {
                stopReason = StopReason.FAILURE_THRESHOLD;
                break;
            }
            next = extraction.nextPage().get();
        }

        SiteScrapeSummary summary = new SiteScrapeSummary(
            site,
            pagesFetched,
            pagesFailed,
            listings.size(),
            parseSkips,
            stopReason
        );
        log.info(
            "Site summary site={} pagesFetched={} pagesFailed={} listings={} parseSkips={} stop={} errors={}",
            site.key(),
            pagesFetched,
            pagesFailed,
            listings.size(),
            parseSkips,
            stopReason,
            errors.size()
        );
        return new SiteScrapeResult(summary, listings, errors);
    }
}
