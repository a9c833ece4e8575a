package com.propertymarket.scraper.crawl.service;

import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.model.RunResult;
import com.propertymarket.scraper.crawl.model.ScrapeError;
import com.propertymarket.scraper.crawl.model.ScrapeRunRequest;
import com.propertymarket.scraper.crawl.model.SiteId;
import com.propertymarket.scraper.crawl.model.SiteScrapeSummary;
import com.propertymarket.scraper.crawl.output.ListingCsvWriter;
import com.propertymarket.scraper.crawl.output.RunSummaryJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_INVALID_INPUT = 2;

    private final ScraperProperties properties;
    private final ScrapeOrchestratorService orchestratorService;
    private final ListingCsvWriter csvWriter;
    private final RunSummaryJsonWriter summaryWriter;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapeOrchestratorService orchestratorService,
        ListingCsvWriter csvWriter,
        RunSummaryJsonWriter summaryWriter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.csvWriter = csvWriter;
        this.summaryWriter = summaryWriter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        int exitCode = execute();
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int execute() {
        ScraperProperties.Cli cli = properties.getCli();
        RunResult result;
        try {
            List<SiteId> sites = SiteId.parseSelection(cli.getSites());
            result = orchestratorService.run(new ScrapeRunRequest(cli.getCity(), sites));
        } catch (IllegalArgumentException e) {
            log.error("Invalid scrape request: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        log.info(
            "Scrape run city={} completed with status {} listings={} errors={}",
            result.city(),
            result.status(),
            result.listings().size(),
            result.errors().size()
        );
        for (SiteScrapeSummary site : result.siteSummaries()) {
            log.info(
                "Summary {}: pages={}, failedPages={}, raw={}, skipped={}, stop={}",
                site.site().key(),
                site.pagesFetched(),
                site.pagesFailed(),
                site.rawListingCount(),
                site.parseSkipCount(),
                site.stopReason()
            );
        }
        if (!result.isSuccessful()) {
            for (ScrapeError error : result.errors()) {
                log.error("Run error type={} site={} message={}", error.type(), error.site(), error.message());
            }
            return EXIT_RUN_FAILED;
        }

        if (cli.isWriteCsv()) {
            Path directory = Path.of(properties.getOutput().getDirectory());
            try {
                csvWriter.write(result, directory);
                summaryWriter.write(result, directory);
            } catch (IOException e) {
                log.error("Failed to write scrape output to {}", directory, e);
                return EXIT_RUN_FAILED;
            }
        }
        return EXIT_OK;
    }
}
