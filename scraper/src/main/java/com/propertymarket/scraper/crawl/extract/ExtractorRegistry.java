package com.propertymarket.scraper.crawl.extract;

import com.propertymarket.scraper.crawl.model.SiteId;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ExtractorRegistry {
    private final Map<SiteId, SiteExtractor> extractors = new EnumMap<>(SiteId.class);

    public ExtractorRegistry(List<SiteExtractor> extractors) {
        for (SiteExtractor extractor : extractors) {
            SiteExtractor previous = this.extractors.put(extractor.site(), extractor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate extractor for site " + extractor.site());
            }
        }
    }

    public SiteExtractor forSite(SiteId site) {
        SiteExtractor extractor = extractors.get(site);
        if (extractor == null) {
            throw new IllegalArgumentException("No extractor registered for site " + site);
        }
        return extractor;
    }
}
