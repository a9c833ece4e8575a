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
import java.util.Map;
import java.util.regex.Pattern;

@Component
public final class CommonFloorExtractor extends AbstractSiteExtractor {
    private static final Pattern AREA_UNIT = Pattern.compile("(?i)sq\\.?\\s*(ft|m|yd|yrd)|sqft|acre");
    private static final Pattern BEDROOMS = Pattern.compile("(?i)\\d+\\s*(bhk|bed)");

    public CommonFloorExtractor(ScraperProperties properties) {
        super(properties);
    }

    @Override
    public SiteId site() {
        return SiteId.COMMONFLOOR;
    }

    @Override
    protected List<Element> selectCards(Document document) {
        return document.select("div.snb-content-list");
    }

    @Override
    protected RawListing parseCard(Element card, FetchRequest page) {
        String title = text(card, "div.snb-projecttile-top a h2");
        String price = null;
        String area = null;
        String bedrooms = null;
        for (Element cell : card.select("tbody td")) {
            String value = cell.text().trim();
            if (value.isEmpty()) {
                continue;
            }
            if (price == null && cell.selectFirst("i.icon-inr") != null) {
                price = "₹" + value;
            } else if (area == null && AREA_UNIT.matcher(value).find()) {
                area = value;
            } else if (bedrooms == null && BEDROOMS.matcher(value).find()) {
                bedrooms = value;
            }
        }
        String location = text(card, "div.snb-projecttile-top span.snb-loc");
        if (location == null) {
            location = locationFromTitle(title);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(RawListing.FIELD_SELLER, text(card, "h3.proSnbp"));
        fields.put(RawListing.FIELD_BEDROOMS, bedrooms);
        return listing(page, href(card, "div.snb-projecttile-top a[href]"), title, price, area, location, fields);
    }

    @Override
    protected String nextPageSelector() {
        return "a.pagination-next[href], link[rel=next][href]";
    }
}
