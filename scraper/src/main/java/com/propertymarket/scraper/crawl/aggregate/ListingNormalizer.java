package com.propertymarket.scraper.crawl.aggregate;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses listing price and area text as shown on Indian property portals: rupee prefixes,
 * lakh/crore suffixes and lakh-style digit grouping ("45,00,000").
 */
@Component
public class ListingNormalizer {
    private static final BigDecimal CRORE = BigDecimal.valueOf(10_000_000L);
    private static final BigDecimal LAKH = BigDecimal.valueOf(100_000L);
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000L);
    private static final BigDecimal SQFT_PER_SQM = new BigDecimal("10.7639");
    private static final BigDecimal SQFT_PER_SQYD = BigDecimal.valueOf(9);
    private static final BigDecimal SQFT_PER_ACRE = BigDecimal.valueOf(43_560);

    // a minus counts as a sign only when it does not follow a word ("carpet-650")
    private static final String NUMBER = "((?:(?<![a-z0-9])-\\s*)?\\d[\\d,]*(?:\\.\\d+)?)";
    private static final String AREA_UNITS = "sq\\.?\\s*ft\\.?|sqft|square\\s*feet|sq\\.?\\s*f(?![a-z])"
        + "|sq\\.?\\s*m(?:eters?|etres?|tr)?\\.?(?![a-z])|sqm|square\\s*met(?:er|re)s?"
        + "|sq\\.?\\s*y(?:ar)?ds?|sq\\.?\\s*yrd|sqyrd|acres?";

    private static final Pattern PRICE = Pattern.compile(
        NUMBER + "\\s*(crores?|cr|lakhs?|lacs?|l|k|thousand)?(?![a-z])"
    );
    private static final Pattern PRICE_UNIT = Pattern.compile("(?<![a-z])(crores?|cr|lakhs?|lacs?|l|k|thousand)(?![a-z])");
    private static final Pattern AREA = Pattern.compile(NUMBER + "\\s*(" + AREA_UNITS + ")?");
    // upper bound of a range such as "60 - 70 sq m"; the unit applies to both bounds
    private static final Pattern AREA_RANGE_TAIL = Pattern.compile(
        "^\\s*(?:-|\u2013|to)\\s*\\d[\\d,]*(?:\\.\\d+)?\\s*(" + AREA_UNITS + ")"
    );
    private static final Pattern BEDROOMS = Pattern.compile("(\\d{1,2})\\s*(?:bhk|bed|rk)");

    public Optional<BigDecimal> parsePrice(String priceText) {
        if (priceText == null || priceText.isBlank()) {
            return Optional.empty();
        }
        String text = stripPriceNoise(priceText);
        Matcher matcher = PRICE.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        BigDecimal amount = number(matcher.group(1));
        if (amount == null) {
            return Optional.empty();
        }
        String unit = matcher.group(2);
        if (unit == null) {
            // "45 - 60 Lac": the unit is only written after the upper bound
            Matcher later = PRICE_UNIT.matcher(text.substring(matcher.end()));
            if (later.find()) {
                unit = later.group(1);
            }
        }
        BigDecimal price = amount.multiply(multiplier(unit)).setScale(0, RoundingMode.HALF_UP);
        return price.signum() > 0 ? Optional.of(price) : Optional.empty();
    }

    public Optional<BigDecimal> parseAreaSqFt(String areaText) {
        if (areaText == null || areaText.isBlank()) {
            return Optional.empty();
        }
        String text = areaText.toLowerCase(Locale.ROOT).replace('\u00A0', ' ');
        Matcher matcher = AREA.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        BigDecimal amount = number(matcher.group(1));
        if (amount == null) {
            return Optional.empty();
        }
        String unit = matcher.group(2);
        if (unit == null) {
            Matcher tail = AREA_RANGE_TAIL.matcher(text.substring(matcher.end()));
            if (tail.find()) {
                unit = tail.group(1);
            }
        }
        BigDecimal sqft = amount.multiply(sqftFactor(unit)).setScale(2, RoundingMode.HALF_UP);
        return sqft.signum() > 0 ? Optional.of(sqft) : Optional.empty();
    }

    public Optional<Integer> parseBedrooms(String... candidates) {
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            Matcher matcher = BEDROOMS.matcher(candidate.toLowerCase(Locale.ROOT));
            if (matcher.find()) {
                return Optional.of(Integer.parseInt(matcher.group(1)));
            }
        }
        return Optional.empty();
    }

    private String stripPriceNoise(String priceText) {
        String text = priceText.toLowerCase(Locale.ROOT).replace('\u00A0', ' ');
        int perIdx = text.indexOf(" per ");
        if (perIdx < 0) {
            perIdx = text.indexOf("/sq");
        }
        if (perIdx > 0) {
            text = text.substring(0, perIdx);
        }
        return text
            .replace("₹", " ")
            .replace("inr", " ")
            .replaceAll("\\brs\\.?", " ")
            .trim();
    }

    private BigDecimal multiplier(String unit) {
        if (unit == null) {
            return BigDecimal.ONE;
        }
        if (unit.startsWith("cr")) {
            return CRORE;
        }
        if (unit.startsWith("l")) {
            return LAKH;
        }
        if (unit.startsWith("k") || unit.startsWith("thousand")) {
            return THOUSAND;
        }
        return BigDecimal.ONE;
    }

    private BigDecimal sqftFactor(String unit) {
        if (unit == null) {
            return BigDecimal.ONE;
        }
        String compact = unit.replaceAll("[\\s.]", "");
        if (compact.startsWith("acre")) {
            return SQFT_PER_ACRE;
        }
        if (compact.startsWith("sqy") || compact.startsWith("sqyrd")) {
            return SQFT_PER_SQYD;
        }
        if (compact.startsWith("sqm") || compact.startsWith("squaremet")) {
            return SQFT_PER_SQM;
        }
        return BigDecimal.ONE;
    }

    private BigDecimal number(String digits) {
        String plain = digits.replace(",", "").replaceAll("\\s", "");
        if (plain.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(plain);
        } catch (NumberFormatException ignored) {
            return null;
        }
    }
}
