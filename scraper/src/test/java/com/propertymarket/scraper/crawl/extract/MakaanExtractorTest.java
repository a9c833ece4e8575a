package com.propertymarket.scraper.crawl.extract;

import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.model.ExtractionResult;
import com.propertymarket.scraper.crawl.model.RawListing;
import com.propertymarket.scraper.crawl.model.SiteId;
import org.junit.jupiter.api.Test;

import static com.propertymarket.scraper.crawl.extract.ExtractorTestSupport.fixture;
import static com.propertymarket.scraper.crawl.extract.ExtractorTestSupport.okPage;
import static org.assertj.core.api.Assertions.assertThat;

class MakaanExtractorTest {
    private static final String SEARCH_URL = "https://www.makaan.com/pune-residential-property/buy-property-in-pune-city";

    private final MakaanExtractor extractor = new MakaanExtractor(new ScraperProperties());

    @Test
    void joinsValueAndUnitSpans() throws Exception {
        ExtractionResult result = extractor.extract(okPage(SiteId.MAKAAN, SEARCH_URL, 1, fixture("makaan-pune-page1.html")));

        assertThat(result.listings()).hasSize(2);
        RawListing first = result.listings().get(0);
        assertThat(first.title()).isEqualTo("2 BHK Apartment in Baner");
        assertThat(first.priceText()).isEqualTo("45 L");
        assertThat(first.areaText()).isEqualTo("650 sq ft");
        assertThat(first.location()).isEqualTo("Baner");
        assertThat(first.sourceUrl()).isEqualTo("https://www.makaan.com/pune/kohinoor-grandeur-baner-2bhk-apartment-for-sale-5568421/");
        assertThat(first.rawField(RawListing.FIELD_SELLER)).isEqualTo("Kohinoor Group");
        assertThat(first.rawField(RawListing.FIELD_BEDROOMS)).isEqualTo("2 BHK");
        assertThat(first.rawField(RawListing.FIELD_PRICE_PER_SQFT)).isEqualTo("6,923 / sq ft");

        RawListing second = result.listings().get(1);
        assertThat(second.location()).isEqualTo("Hinjewadi Phase 1");
        assertThat(second.priceText()).isEqualTo("1.2 Cr");
        assertThat(second.areaText()).isEqualTo("52 sq m");
        assertThat(second.rawField(RawListing.FIELD_SELLER)).isNull();

        assertThat(result.nextPage()).isEmpty();
    }

    @Test
    void fallsBackToInfoWrapCards() {
        String html =
            """
                <div class="infoWrap">
                  <div class="title-line"><a href="/pune/p-1/">3 BHK Villa in Baner</a></div>
                  <table><tbody><tr><td class="price"><span class="val">2.1</span><span class="unit">Cr</span></td></tr></tbody></table>
                </div>
                <ul><li class="next-page"><a href="/mk/pune?page=2">next</a></li></ul>
                """;

        ExtractionResult result = extractor.extract(okPage(SiteId.MAKAAN, SEARCH_URL, 1, html));

        assertThat(result.listings()).hasSize(1);
        assertThat(result.listings().get(0).location()).isEqualTo("Baner");
        assertThat(result.nextPage()).isPresent();
        assertThat(result.nextPage().get().url()).isEqualTo("https://www.makaan.com/mk/pune?page=2");
    }
}
