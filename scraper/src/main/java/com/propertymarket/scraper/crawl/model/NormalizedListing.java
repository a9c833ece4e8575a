package com.propertymarket.scraper.crawl.model;

import java.math.BigDecimal;
import java.time.Instant;

public record NormalizedListing(
    String id,
    SiteId site,
    String title,
    String location,
    BigDecimal price,
    BigDecimal areaSqFt,
    String city,
    Integer bedroomCount,
    String seller,
    String url,
    Instant scrapedAt
) {
}
