package com.propertymarket.scraper.crawl.extract;

import com.propertymarket.scraper.crawl.model.FetchRequest;
import com.propertymarket.scraper.crawl.model.FetchResult;
import com.propertymarket.scraper.crawl.model.FetchStatus;
import com.propertymarket.scraper.crawl.model.SiteId;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

final class ExtractorTestSupport {
    private ExtractorTestSupport() {
    }

    static String fixture(String name) throws IOException {
        return Files.readString(Path.of("src/test/resources/fixtures/" + name));
    }

    static FetchResult okPage(SiteId site, String url, int page, String body) {
        return new FetchResult(
            new FetchRequest(url, site, page),
            FetchStatus.OK,
            200,
            body,
            "text/html; charset=UTF-8",
            Instant.now(),
            Duration.ofMillis(5),
            1,
            null,
            null
        );
    }
}
