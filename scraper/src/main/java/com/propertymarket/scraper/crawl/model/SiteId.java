package com.propertymarket.scraper.crawl.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

public enum SiteId {
    MAGICBRICKS("magicbricks", "https://www.magicbricks.com/ready-to-move-flats-in-{city}-pppfs"),
    MAKAAN("makaan", "https://www.makaan.com/{city}-residential-property/buy-property-in-{city}-city"),
    COMMONFLOOR("commonfloor", "https://www.commonfloor.com/{city}-property/projects");

    public static final String ALL = "all";

    private final String key;
    private final String defaultSearchUrlTemplate;

    SiteId(String key, String defaultSearchUrlTemplate) {
        this.key = key;
        this.defaultSearchUrlTemplate = defaultSearchUrlTemplate;
    }

    public String key() {
        return key;
    }

    public String defaultSearchUrlTemplate() {
        return defaultSearchUrlTemplate;
    }

    public static SiteId fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Site name is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SiteId site : values()) {
            if (site.key.equals(normalized)) {
                return site;
            }
        }
        throw new IllegalArgumentException(
            "Invalid site '" + value.trim() + "'. Choose one of " + Arrays.toString(keys()) + " or '" + ALL + "'"
        );
    }

    /**
     * Parses a comma separated selection such as {@code "makaan,magicbricks"} or {@code "all"}.
     * Order of first occurrence is kept; it is the dedup tie-break order for the run.
     */
    public static List<SiteId> parseSelection(String selection) {
        if (selection == null || selection.isBlank()) {
            throw new IllegalArgumentException("At least one site must be selected");
        }
        LinkedHashSet<SiteId> out = new LinkedHashSet<>();
        for (String part : selection.split(",")) {
            String token = part.trim();
            if (token.isEmpty()) {
                continue;
            }
            if (ALL.equalsIgnoreCase(token)) {
                out.addAll(Arrays.asList(values()));
            } else {
                out.add(fromKey(token));
            }
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("At least one site must be selected");
        }
        return new ArrayList<>(out);
    }

    private static String[] keys() {
        return Arrays.stream(values()).map(SiteId::key).toArray(String[]::new);
    }
}
