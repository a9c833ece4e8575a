package com.propertymarket.scraper.crawl.aggregate;

import com.propertymarket.scraper.crawl.model.AggregationResult;
import com.propertymarket.scraper.crawl.model.NormalizedListing;
import com.propertymarket.scraper.crawl.model.RawListing;
import com.propertymarket.scraper.crawl.model.ScrapeError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalizes raw listings and collapses duplicates. Input order is the tie-break: the first
 * listing seen for an identity key is kept, so callers pass listings in site selection order.
 */
@Component
public class ListingAggregator {
    private static final Logger log = LoggerFactory.getLogger(ListingAggregator.class);

    private final ListingNormalizer normalizer;
    private final IdentityKeyFactory identityKeyFactory;

    public ListingAggregator(ListingNormalizer normalizer, IdentityKeyFactory identityKeyFactory) {
        this.normalizer = normalizer;
        this.identityKeyFactory = identityKeyFactory;
    }

    public AggregationResult aggregate(List<RawListing> rawListings, String city, Instant scrapedAt) {
        Map<String, NormalizedListing> byId = new LinkedHashMap<>();
        List<ScrapeError> dataQualityErrors = new ArrayList<>();
        int duplicates = 0;

        for (RawListing raw : rawListings) {
            Optional<BigDecimal> price = normalizer.parsePrice(raw.priceText());
            Optional<BigDecimal> area = normalizer.parseAreaSqFt(raw.areaText());
            if (price.isEmpty() || area.isEmpty()) {
                String problem = describeProblem(raw, price.isEmpty(), area.isEmpty());
                log.debug("data quality site={} url={} problem={}", raw.site().key(), raw.sourceUrl(), problem);
                dataQualityErrors.add(ScrapeError.dataQuality(raw, problem));
                continue;
            }

            String id = identityKeyFactory.identityKey(raw.title(), raw.location(), price.get(), area.get(), city);
            if (byId.containsKey(id)) {
                duplicates++;
                continue;
            }
            Integer bedrooms = normalizer.parseBedrooms(raw.rawField(RawListing.FIELD_BEDROOMS), raw.title()).orElse(null);
            byId.put(id, new NormalizedListing(
                id,
                raw.site(),
                raw.title(),
                raw.location(),
                price.get(),
                area.get(),
                city,
                bedrooms,
                raw.rawField(RawListing.FIELD_SELLER),
                raw.sourceUrl(),
                scrapedAt
            ));
        }

        if (duplicates > 0) {
            log.info("dedup collapsed={} kept={}", duplicates, byId.size());
        }
        return new AggregationResult(new ArrayList<>(byId.values()), dataQualityErrors, duplicates);
    }

    private String describeProblem(RawListing raw, boolean badPrice, boolean badArea) {
        List<String> parts = new ArrayList<>();
        if (badPrice) {
            parts.add(raw.priceText() == null ? "price missing" : "unparseable price '" + raw.priceText() + "'");
        }
        if (badArea) {
            parts.add(raw.areaText() == null ? "area missing" : "unparseable area '" + raw.areaText() + "'");
        }
        return String.join("; ", parts);
    }
}
