package com.propertymarket.scraper.crawl.extract;

import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.model.ExtractionResult;
import com.propertymarket.scraper.crawl.model.FetchRequest;
import com.propertymarket.scraper.crawl.model.FetchResult;
import com.propertymarket.scraper.crawl.model.RawListing;
import com.propertymarket.scraper.crawl.model.SiteId;
import com.propertymarket.scraper.crawl.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public abstract sealed class AbstractSiteExtractor implements SiteExtractor
    permits MagicBricksExtractor, MakaanExtractor, CommonFloorExtractor {

    private static final Logger log = LoggerFactory.getLogger(AbstractSiteExtractor.class);
    private static final String PAGE_PARAM = "page";

    private final ScraperProperties properties;

    protected AbstractSiteExtractor(ScraperProperties properties) {
        this.properties = properties;
    }

    @Override
    public FetchRequest searchRequest(String city, int page) {
        String url = properties.searchUrlTemplate(site()).replace("{city}", UrlUtils.citySlug(city));
        if (page > 1) {
            url = UrlUtils.withQueryParam(url, PAGE_PARAM, Integer.toString(page));
        }
        return new FetchRequest(url, site(), page);
    }

    @Override
    public final ExtractionResult extract(FetchResult result) {
        if (result == null || !result.isOk() || !result.hasBody()) {
            return ExtractionResult.empty();
        }
        FetchRequest request = result.request();
        try {
            Document document = Jsoup.parse(result.body(), request.url());
            List<RawListing> listings = new ArrayList<>();
            int skipped = 0;
            for (Element card : selectCards(document)) {
                RawListing listing = parseCard(card, request);
                if (listing == null) {
                    skipped++;
                } else {
                    listings.add(listing);
                }
            }
            if (skipped > 0) {
                log.debug("parse skips site={} url={} skipped={}", site().key(), request.url(), skipped);
            }
            return new ExtractionResult(listings, nextPage(document, request), skipped, null);
        } catch (RuntimeException e) {
            log.warn("extraction fault site={} url={} error={}", site().key(), request.url(), e.toString());
            return ExtractionResult.fault(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    protected abstract List<Element> selectCards(Document document);

    /**
     * Returns null when the card lacks the fields needed to be a listing at all.
     */
    protected abstract RawListing parseCard(Element card, FetchRequest page);

    protected abstract String nextPageSelector();

    private Optional<FetchRequest> nextPage(Document document, FetchRequest current) {
        Element link = document.selectFirst(nextPageSelector());
        if (link == null) {
            return Optional.empty();
        }
        String href = link.absUrl("href");
        if (href.isBlank()) {
            href = UrlUtils.resolve(current.url(), link.attr("href"));
        }
        if (href == null || href.isBlank()) {
            return Optional.empty();
        }
        if (UrlUtils.normalizeForKey(href).equals(current.cacheKey())) {
            return Optional.empty();
        }
        return Optional.of(new FetchRequest(href, site(), current.page() + 1));
    }

    protected RawListing listing(
        FetchRequest page,
        String url,
        String title,
        String priceText,
        String areaText,
        String location,
        Map<String, String> rawFields
    ) {
        if (isBlank(title)) {
            return null;
        }
        if (isBlank(priceText) && isBlank(areaText) && isBlank(location)) {
            return null;
        }
        String sourceUrl = isBlank(url) ? page.url() : url;
        return new RawListing(site(), sourceUrl, clean(title), clean(priceText), clean(areaText), clean(location), rawFields);
    }

    protected static String text(Element root, String cssQuery) {
        Element element = root.selectFirst(cssQuery);
        if (element == null) {
            return null;
        }
        String value = element.text().trim();
        return value.isEmpty() ? null : value;
    }

    protected static String href(Element root, String cssQuery) {
        Element element = root.selectFirst(cssQuery);
        if (element == null) {
            return null;
        }
        String value = element.absUrl("href");
        return value.isBlank() ? null : value;
    }

    protected static String joinNonBlank(String separator, String... parts) {
        List<String> kept = new ArrayList<>();
        for (String part : parts) {
            if (!isBlank(part)) {
                kept.add(part.trim());
            }
        }
        return kept.isEmpty() ? null : String.join(separator, kept);
    }

    /**
     * "2 BHK Flat for Sale in Baner, Pune" gives "Baner, Pune".
     */
    protected static String locationFromTitle(String title) {
        if (isBlank(title)) {
            return null;
        }
        int idx = title.toLowerCase(Locale.ROOT).lastIndexOf(" in ");
        if (idx < 0) {
            return null;
        }
        String tail = title.substring(idx + 4).trim();
        return tail.isEmpty() ? null : tail;
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = value.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }
}
