package com.propertymarket.scraper.crawl.extract;

import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.model.FetchRequest;
import com.propertymarket.scraper.crawl.model.RawListing;
import com.propertymarket.scraper.crawl.model.SiteId;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public final class MakaanExtractor extends AbstractSiteExtractor {
    private static final String BUILDER_NOISE = "BUILDER0";

    public MakaanExtractor(ScraperProperties properties) {
        super(properties);
    }

    @Override
    public SiteId site() {
        return SiteId.MAKAAN;
    }

    @Override
    protected List<Element> selectCards(Document document) {
        Elements cards = document.select("div.search-result-wrap li.cardholder");
        if (cards.isEmpty()) {
            cards = document.select("div.infoWrap");
        }
        return cards;
    }

    @Override
    protected RawListing parseCard(Element card, FetchRequest page) {
        String title = text(card, "div.title-line a");
        // value and unit are separate spans: "45" + "L"
        String price = joinNonBlank(" ", text(card, "td.price span.val"), text(card, "td.price span.unit"));
        String area = joinNonBlank(" ", text(card, "td.size span.val"), text(card, "td.size span.unit"));
        String location = text(card, "div.locWrap a.loclink");
        if (location == null) {
            location = text(card, "span.locName");
        }
        if (location == null) {
            location = locationFromTitle(title);
        }

        String seller = text(card, "div.seller-info a.seller-name");
        if (seller != null) {
            seller = seller.replace(BUILDER_NOISE, "").trim();
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(RawListing.FIELD_SELLER, seller);
        fields.put(RawListing.FIELD_BEDROOMS, text(card, "span.bhk"));
        fields.put(RawListing.FIELD_PRICE_PER_SQFT, text(card, "td.rate"));
        fields.put(RawListing.FIELD_STATUS, text(card, "td.val.status, li.status"));
        return listing(page, href(card, "div.title-line a[href]"), title, price, area, location, fields);
    }

    @Override
    protected String nextPageSelector() {
        return "a[rel=next][href], li.next-page a[href]";
    }
}
