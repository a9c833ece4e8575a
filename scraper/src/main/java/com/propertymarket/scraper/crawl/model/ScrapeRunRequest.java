package com.propertymarket.scraper.crawl.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

public record ScrapeRunRequest(String city, List<SiteId> sites) {

    public String normalizedCity() {
        if (city == null) {
            return "";
        }
        return city.trim().toLowerCase(Locale.ROOT);
    }

    public List<SiteId> orderedSites() {
        if (sites == null) {
            return List.of();
        }
        LinkedHashSet<SiteId> out = new LinkedHashSet<>();
        for (SiteId site : sites) {
            if (site != null) {
                out.add(site);
            }
        }
        return new ArrayList<>(out);
    }
}
