package com.propertymarket.scraper.crawl.extract;

import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.model.ExtractionResult;
import com.propertymarket.scraper.crawl.model.RawListing;
import com.propertymarket.scraper.crawl.model.SiteId;
import org.junit.jupiter.api.Test;

import static com.propertymarket.scraper.crawl.extract.ExtractorTestSupport.fixture;
import static com.propertymarket.scraper.crawl.extract.ExtractorTestSupport.okPage;
import static org.assertj.core.api.Assertions.assertThat;

class CommonFloorExtractorTest {
    private static final String SEARCH_URL = "https://www.commonfloor.com/pune-property/projects";

    private final CommonFloorExtractor extractor = new CommonFloorExtractor(new ScraperProperties());

    @Test
    void classifiesTableCells() throws Exception {
        ExtractionResult result = extractor.extract(
            okPage(SiteId.COMMONFLOOR, SEARCH_URL, 1, fixture("commonfloor-pune-page1.html"))
        );

        assertThat(result.listings()).hasSize(1);
        assertThat(result.parseSkips()).isEqualTo(1);

        RawListing listing = result.listings().get(0);
        assertThat(listing.title()).isEqualTo("Kumar Pebble Park");
        assertThat(listing.priceText()).isEqualTo("₹62.5 Lakh");
        assertThat(listing.areaText()).isEqualTo("980 Sq. Ft.");
        assertThat(listing.location()).isEqualTo("Hadapsar, Pune");
        assertThat(listing.rawField(RawListing.FIELD_BEDROOMS)).isEqualTo("2 BHK Apartment");
        assertThat(listing.rawField(RawListing.FIELD_SELLER)).isEqualTo("Kumar Properties");
        assertThat(listing.sourceUrl()).isEqualTo("https://www.commonfloor.com/kumar-pebble-park-hadapsar/povp-3k1l2m");

        assertThat(result.nextPage()).isPresent();
        assertThat(result.nextPage().get().url()).isEqualTo("https://www.commonfloor.com/cf/pune?page=2");
        assertThat(result.nextPage().get().page()).isEqualTo(2);
    }
}
