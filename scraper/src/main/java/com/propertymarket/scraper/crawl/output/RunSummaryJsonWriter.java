package com.propertymarket.scraper.crawl.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertymarket.scraper.crawl.model.RunResult;
import com.propertymarket.scraper.crawl.model.ScrapeError;
import com.propertymarket.scraper.crawl.model.SiteId;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the run metadata (status, per-site summaries, metrics and errors) next to the listings
 * csv. Listings themselves are not repeated.
 */
@Component
public class RunSummaryJsonWriter {
    private final ObjectMapper objectMapper;

    public RunSummaryJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path write(RunResult result, Path directory) throws IOException {
        Files.createDirectories(directory);
        String csvName = ListingCsvWriter.fileName(result);
        Path target = directory.resolve(csvName.substring(0, csvName.length() - ".csv".length()) + "-summary.json");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), summary(result));
        return target;
    }

    Map<String, Object> summary(RunResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("city", result.city());
        out.put("status", result.status());
        out.put("cancelled", result.cancelled());
        out.put("sites", result.sitesScraped().stream().map(SiteId::key).toList());
        out.put("listingCount", result.listings().size());
        out.put("startedAt", result.startedAt());
        out.put("finishedAt", result.finishedAt());
        out.put("metrics", result.metrics());
        out.put("siteSummaries", result.siteSummaries());
        List<Map<String, Object>> errors = result.errors().stream().map(RunSummaryJsonWriter::error).toList();
        out.put("errors", errors);
        return out;
    }

    private static Map<String, Object> error(ScrapeError error) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", error.type());
        out.put("site", error.site() == null ? null : error.site().key());
        out.put("url", error.url());
        out.put("httpStatus", error.httpStatus());
        out.put("message", error.message());
        out.put("occurredAt", error.occurredAt());
        return out;
    }
}
