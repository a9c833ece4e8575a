package com.propertymarket.scraper.crawl.extract;

import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.model.FetchRequest;
import com.propertymarket.scraper.crawl.model.RawListing;
import com.propertymarket.scraper.crawl.model.SiteId;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public final class MagicBricksExtractor extends AbstractSiteExtractor {

    public MagicBricksExtractor(ScraperProperties properties) {
        super(properties);
    }

    @Override
    public SiteId site() {
        return SiteId.MAGICBRICKS;
    }

    @Override
    protected List<Element> selectCards(Document document) {
        return document.select("div.mb-srp__card");
    }

    @Override
    protected RawListing parseCard(Element card, FetchRequest page) {
        String title = text(card, "h2.mb-srp__card--title");
        String price = text(card, "div.mb-srp__card__price--amount");

        String carpetArea = null;
        String superArea = null;
        String status = null;
        for (Element item : card.select("div.mb-srp__card__summary__list--item")) {
            String kind = item.attr("data-summary").toLowerCase(Locale.ROOT);
            String value = text(item, "div.mb-srp__card__summary--value");
            switch (kind) {
                case "carpet-area" -> carpetArea = value;
                case "super-area", "plot-area" -> superArea = superArea == null ? value : superArea;
                case "status" -> status = value;
                default -> {
                }
            }
        }
        String area = carpetArea != null ? carpetArea : superArea;

        String society = text(card, "a.mb-srp__card__society--name, span.mb-srp__card__society--name");
        String location = locationFromTitle(title);
        if (location == null) {
            location = society;
        }

        String seller = text(card, "div.mb-srp__card__ads--name");
        if (seller != null && seller.regionMatches(true, 0, "Owner:", 0, 6)) {
            seller = seller.substring(6).trim();
        }

        String url = href(card, "a.mb-srp__card__link[href]");
        if (url == null) {
            url = href(card, "h2.mb-srp__card--title a[href]");
        }
        if (url == null) {
            url = enclosingAnchorHref(card, card.selectFirst("h2.mb-srp__card--title"));
        }
        if (isBlank(url) && card.hasAttr("data-url")) {
            url = card.absUrl("data-url");
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(RawListing.FIELD_SELLER, seller);
        fields.put(RawListing.FIELD_PRICE_PER_SQFT, text(card, "div.mb-srp__card__price--size"));
        fields.put(RawListing.FIELD_STATUS, status);
        fields.put("society", society);
        fields.put("super_area", superArea);
        return listing(page, url, title, price, area, location, fields);
    }

    private static String enclosingAnchorHref(Element card, Element element) {
        if (element == null) {
            return null;
        }
        for (Element parent : element.parents()) {
            if (parent == card) {
                return null;
            }
            if ("a".equals(parent.tagName()) && parent.hasAttr("href")) {
                return parent.absUrl("href");
            }
        }
        return null;
    }

    @Override
    protected String nextPageSelector() {
        return "a.mb-pagination__list--next[href], link[rel=next][href]";
    }
}
