package com.propertymarket.scraper.crawl.output;

import com.propertymarket.scraper.crawl.model.NormalizedListing;
import com.propertymarket.scraper.crawl.model.RunResult;
import com.propertymarket.scraper.crawl.model.SiteId;
import com.propertymarket.scraper.crawl.util.UrlUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Writes the normalized listings of a run as one CSV file per run.
 */
@Component
public class ListingCsvWriter {
    private static final Logger log = LoggerFactory.getLogger(ListingCsvWriter.class);
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH);

    static final String[] HEADER = {
        "id",
        "site",
        "title",
        "location",
        "price",
        "area_sq_ft",
        "bedroom_count",
        "seller",
        "city",
        "url",
        "scraped_at"
    };

    public Path write(RunResult result, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(fileName(result));
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .setRecordSeparator("\n")
            .build();
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (NormalizedListing listing : result.listings()) {
                printer.printRecord(
                    listing.id(),
                    listing.site().key(),
                    listing.title(),
                    listing.location(),
                    plain(listing.price()),
                    plain(listing.areaSqFt()),
                    listing.bedroomCount(),
                    listing.seller(),
                    listing.city(),
                    listing.url(),
                    listing.scrapedAt()
                );
            }
        }
        log.info("Wrote listings csv path={} rows={}", target, result.listings().size());
        return target;
    }

    public static String fileName(RunResult result) {
        String sites = result.sitesScraped().stream().map(SiteId::key).collect(Collectors.joining("-"));
        LocalDate date = LocalDate.ofInstant(result.startedAt(), ZoneId.systemDefault());
        return UrlUtils.citySlug(result.city()) + "-" + sites + "-" + FILE_DATE.format(date) + ".csv";
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.toPlainString();
    }
}
