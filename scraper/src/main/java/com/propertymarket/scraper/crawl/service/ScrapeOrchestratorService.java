package com.propertymarket.scraper.crawl.service;

import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.aggregate.ListingAggregator;
import com.propertymarket.scraper.crawl.extract.ExtractorRegistry;
import com.propertymarket.scraper.crawl.extract.SiteExtractor;
import com.propertymarket.scraper.crawl.http.FetchResultCache;
import com.propertymarket.scraper.crawl.model.AggregationResult;
import com.propertymarket.scraper.crawl.model.RawListing;
import com.propertymarket.scraper.crawl.model.RunMetrics;
import com.propertymarket.scraper.crawl.model.RunResult;
import com.propertymarket.scraper.crawl.model.RunState;
import com.propertymarket.scraper.crawl.model.RunStatus;
import com.propertymarket.scraper.crawl.model.ScrapeError;
import com.propertymarket.scraper.crawl.model.ScrapeErrorType;
import com.propertymarket.scraper.crawl.model.ScrapeRunRequest;
import com.propertymarket.scraper.crawl.model.SiteId;
import com.propertymarket.scraper.crawl.model.SiteScrapeResult;
import com.propertymarket.scraper.crawl.model.SiteScrapeSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one pagination driver per selected site in parallel, then aggregates their listings
 * in site selection order. A run fails only when no site fetched a single page.
 */
@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    private final ScraperProperties properties;
    private final ExtractorRegistry extractorRegistry;
    private final SitePaginationService paginationService;
    private final ListingAggregator aggregator;
    private final MemoryMonitor memoryMonitor;
    private final ExecutorService scrapeExecutor;

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final AtomicReference<ScrapeRunContext> activeContext = new AtomicReference<>();

    public ScrapeOrchestratorService(
        ScraperProperties properties,
        ExtractorRegistry extractorRegistry,
        SitePaginationService paginationService,
        ListingAggregator aggregator,
        MemoryMonitor memoryMonitor,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor
    ) {
        this.properties = properties;
        this.extractorRegistry = extractorRegistry;
        this.paginationService = paginationService;
        this.aggregator = aggregator;
        this.memoryMonitor = memoryMonitor;
        this.scrapeExecutor = scrapeExecutor;
    }

    public RunState state() {
        return state.get();
    }

    /**
     * Asks the active run to stop after the pages currently in flight. Returns false when
     * nothing is running.
     */
    public boolean cancel() {
        ScrapeRunContext context = activeContext.get();
        if (context == null) {
            return false;
        }
        context.cancel();
        log.info("Cancellation requested for scrape run city={}", context.city());
        return true;
    }

    public RunResult run(ScrapeRunRequest request) {
        String city = request.normalizedCity();
        List<SiteId> sites = request.orderedSites();
        if (city.isEmpty()) {
            throw new IllegalArgumentException("City name is required");
        }
        if (sites.isEmpty()) {
            throw new IllegalArgumentException("At least one site must be selected");
        }
        RunState previous = state.getAndUpdate(current -> current == RunState.RUNNING ? current : RunState.RUNNING);
        if (previous == RunState.RUNNING) {
            ScrapeRunContext running = activeContext.get();
            throw new ActiveScrapeRunException(
                "Scrape run already in progress (city=" + (running == null ? "unknown" : running.city()) + ")"
            );
        }

        Instant startedAt = Instant.now();
        int maxDurationSeconds = properties.getRun().getMaxDurationSeconds();
        Instant deadline = maxDurationSeconds > 0 ? startedAt.plusSeconds(maxDurationSeconds) : null;
        ScrapeRunContext context = new ScrapeRunContext(city, new FetchResultCache(), deadline);
        activeContext.set(context);
        MemoryMonitor.Session memory = null;

        try {
            memory = memoryMonitor.start();
            log.info("Scrape run started city={} sites={} deadline={}", city, keys(sites), deadline == null ? "none" : deadline);
            List<CompletableFuture<SiteScrapeResult>> futures = new ArrayList<>();
            for (SiteId site : sites) {
                SiteExtractor extractor = extractorRegistry.forSite(site);
                futures.add(CompletableFuture.supplyAsync(() -> paginationService.scrape(extractor, context), scrapeExecutor));
            }

            List<SiteScrapeResult> siteResults = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                SiteId site = sites.get(i);
                try {
                    siteResults.add(futures.get(i).join());
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("Site scrape failed site={}", site.key(), cause);
                    siteResults.add(new SiteScrapeResult(
                        SiteScrapeSummary.crashed(site),
                        List.of(),
                        List.of(ScrapeError.siteFailure(site, cause.getClass().getSimpleName() + ": " + cause.getMessage()))
                    ));
                }
            }

            List<RawListing> rawListings = new ArrayList<>();
            List<ScrapeError> errors = new ArrayList<>();
            List<SiteScrapeSummary> summaries = new ArrayList<>();
            for (SiteScrapeResult siteResult : siteResults) {
                rawListings.addAll(siteResult.listings());
                errors.addAll(siteResult.errors());
                summaries.add(siteResult.summary());
            }

            AggregationResult aggregation = aggregator.aggregate(rawListings, city, startedAt);
            errors.addAll(aggregation.dataQualityErrors());

            boolean anyPageFetched = summaries.stream().anyMatch(summary -> summary.pagesFetched() > 0);
            RunStatus status = anyPageFetched || !rawListings.isEmpty() ? RunStatus.COMPLETED : RunStatus.FAILED;
            if (status == RunStatus.FAILED) {
                errors.add(ScrapeError.runFailure("No site returned any data for city " + city));
            }

            MemoryMonitor.MemorySnapshot snapshot = memory.stop();
            RunMetrics metrics = new RunMetrics(
                snapshot.elapsedMs(),
                snapshot.peakBytes(),
                snapshot.deltaBytes(),
                context.requestCount(),
                context.attemptCount(),
                context.cacheHitCount(),
                summaries.stream().mapToInt(SiteScrapeSummary::pagesFetched).sum(),
                summaries.stream().mapToInt(SiteScrapeSummary::parseSkipCount).sum(),
                rawListings.size(),
                aggregation.duplicateCount()
            );
            RunResult result = new RunResult(
                city,
                status,
                context.isCancelled(),
                new LinkedHashSet<>(sites),
                aggregation.listings(),
                errors,
                summaries,
                metrics,
                startedAt,
                Instant.now()
            );
            logSummary(result);
            state.set(status == RunStatus.COMPLETED ? RunState.COMPLETED : RunState.FAILED);
            return result;
        } catch (RuntimeException e) {
            log.warn("Scrape run city={} failed", city, e);
            state.set(RunState.FAILED);
            throw e;
        } finally {
            if (memory != null) {
                memory.stop();
            }
            activeContext.set(null);
        }
    }

    private void logSummary(RunResult result) {
        RunMetrics metrics = result.metrics();
        String message = "Run summary city={} status={} cancelled={} sites={} listings={} raw={} duplicates={} "
            + "errors={} dataQuality={} requests={} attempts={} cacheHits={} pages={} parseSkips={} "
            + "elapsedMs={} peakMemoryMb={} memoryDeltaMb={}";
        Object[] args = {
            result.city(),
            result.status(),
            result.cancelled(),
            keys(new ArrayList<>(result.sitesScraped())),
            result.listings().size(),
            metrics.rawListingCount(),
            metrics.duplicateCount(),
            result.errors().size(),
            result.errorCount(ScrapeErrorType.DATA_QUALITY),
            metrics.requestCount(),
            metrics.attemptCount(),
            metrics.cacheHitCount(),
            metrics.pagesFetched(),
            metrics.parseSkipCount(),
            metrics.elapsedMs(),
            String.format("%.2f", metrics.peakMemoryBytes() / 1_000_000.0),
            String.format("%.2f", metrics.memoryDeltaBytes() / 1_000_000.0)
        };
        if (result.isSuccessful()) {
            log.info(message, args);
        } else {
            log.error(message, args);
        }
    }

    private static List<String> keys(List<SiteId> sites) {
        return sites.stream().map(SiteId::key).toList();
    }
}
