package com.propertymarket.scraper.crawl.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SiteIdTest {

    @Test
    void allSelectsEverySiteInDeclarationOrder() {
        assertThat(SiteId.parseSelection("all"))
            .containsExactly(SiteId.MAGICBRICKS, SiteId.MAKAAN, SiteId.COMMONFLOOR);
        assertThat(SiteId.parseSelection(" ALL ")).hasSize(3);
    }

    @Test
    void selectionKeepsFirstOccurrenceOrder() {
        assertThat(SiteId.parseSelection("Makaan, magicbricks,makaan,,"))
            .containsExactly(SiteId.MAKAAN, SiteId.MAGICBRICKS);
    }

    @Test
    void rejectsUnknownOrEmptySelection() {
        assertThatThrownBy(() -> SiteId.parseSelection("99acres"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("99acres")
            .hasMessageContaining("magicbricks");
        assertThatThrownBy(() -> SiteId.parseSelection(" , "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SiteId.parseSelection(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void runRequestNormalizesCityAndDropsRepeatedSites() {
        ScrapeRunRequest request = new ScrapeRunRequest("  Pune ", List.of(SiteId.MAKAAN, SiteId.MAKAAN, SiteId.COMMONFLOOR));

        assertThat(request.normalizedCity()).isEqualTo("pune");
        assertThat(request.orderedSites()).containsExactly(SiteId.MAKAAN, SiteId.COMMONFLOOR);
    }

    @Test
    void fetchRequestRejectsPageZero() {
        assertThatThrownBy(() -> new FetchRequest("https://www.makaan.com/pune", SiteId.MAKAAN, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
