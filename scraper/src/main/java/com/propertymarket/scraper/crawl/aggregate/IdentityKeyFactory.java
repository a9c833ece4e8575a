package com.propertymarket.scraper.crawl.aggregate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.util.HashUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Derives the identity of a listing from normalized structured fields so the same unit
 * posted on several portals, with different wording, hashes to the same id.
 */
@Component
public class IdentityKeyFactory {
    private static final Set<String> TITLE_STOP_WORDS = Set.of(
        "a", "an", "and", "at", "by", "for", "in", "of", "on", "the", "to", "with",
        "sale", "buy", "resale", "new", "ready", "move",
        "flat", "flats", "apartment", "apartments", "property", "residential", "multistorey"
    );
    private static final Set<String> LOCATION_STOP_WORDS = Set.of("near", "in", "at", "the", "road", "rd");

    private final ObjectMapper objectMapper;
    private final ScraperProperties.Dedup dedup;

    public IdentityKeyFactory(ObjectMapper objectMapper, ScraperProperties properties) {
        this.objectMapper = objectMapper;
        this.dedup = properties.getDedup();
    }

    public String identityKey(String title, String location, BigDecimal price, BigDecimal areaSqFt, String city) {
        Set<String> cityTokens = tokens(city, Set.of(), Set.of());
        Map<String, String> stableFields = new TreeMap<>();
        if (dedup.isUseLocation()) {
            stableFields.put("location", String.join(" ", tokens(location, LOCATION_STOP_WORDS, cityTokens)));
        }
        if (dedup.isUsePrice()) {
            stableFields.put("price", roundTo(price, BigDecimal.valueOf(dedup.getPriceRoundTo())));
        }
        if (dedup.isUseArea()) {
            stableFields.put("area_sq_ft", roundTo(areaSqFt, BigDecimal.valueOf(dedup.getAreaRoundTo())));
        }
        if (dedup.isUseTitleTokens()) {
            stableFields.put("title_tokens", String.join(" ", tokens(title, TITLE_STOP_WORDS, cityTokens)));
        }

        String hashPayload;
        try {
            hashPayload = objectMapper.writeValueAsString(stableFields);
        } catch (JsonProcessingException e) {
            hashPayload = stableFields.toString();
        }
        return HashUtils.sha256Hex(hashPayload);
    }

    static SortedSet<String> tokens(String text, Set<String> stopWords, Set<String> excluded) {
        SortedSet<String> out = new TreeSet<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{Nd}]+")) {
            if (!token.isEmpty() && !stopWords.contains(token) && !excluded.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    private String roundTo(BigDecimal value, BigDecimal step) {
        if (value == null) {
            return "";
        }
        return value.divide(step, 0, RoundingMode.HALF_UP).multiply(step).toPlainString();
    }
}
