package com.propertymarket.scraper.crawl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RawListing(
    SiteId site,
    String sourceUrl,
    String title,
    String priceText,
    String areaText,
    String location,
    Map<String, String> rawFields
) {
    public static final String FIELD_SELLER = "seller";
    public static final String FIELD_BEDROOMS = "bedrooms";
    public static final String FIELD_PRICE_PER_SQFT = "price_per_sqft";
    public static final String FIELD_STATUS = "status";

    public RawListing {
        Map<String, String> kept = new LinkedHashMap<>();
        if (rawFields != null) {
            rawFields.forEach((name, value) -> {
                if (name != null && value != null && !value.isBlank()) {
                    kept.put(name, value.trim());
                }
            });
        }
        rawFields = Collections.unmodifiableMap(kept);
    }

    public String rawField(String name) {
        return rawFields.get(name);
    }
}
