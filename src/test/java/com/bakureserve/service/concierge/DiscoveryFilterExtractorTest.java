package com.bakureserve.service.concierge;

import com.bakureserve.model.DiscoveryFilters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DiscoveryFilterExtractorTest {

    private final DiscoveryFilterExtractor extractor = new DiscoveryFilterExtractor();

    @Test
    @DisplayName("romantic rooftop near the boulevard on a budget")
    void derivesTagsPriceAndNeighborhood() {
        DiscoveryFilters filters = extractor.deriveFiltersFromText("romantic rooftop dinner near the boulevard, not expensive");

        assertThat(filters.getTags()).containsExactly("rooftop", "romantic");
        assertThat(filters.getMaxPriceRank()).isEqualTo(1);
        assertThat(filters.isStrictBudget()).isTrue();
        assertThat(filters.getNeighborhood()).isEqualTo("boulevard");
        assertThat(filters.getCuisines()).isNull();
        assertThat(filters.getGroupSize()).isNull();
    }

    @Test
    void affordableDateNight() {
        DiscoveryFilters filters = extractor.deriveFiltersFromText("romantic rooftop date night near boulevard, keep it affordable");

        assertThat(filters.getTags()).containsExactly("rooftop", "romantic");
        assertThat(filters.getMaxPriceRank()).isEqualTo(1);
        assertThat(filters.isStrictBudget()).isTrue();
        assertThat(filters.getNeighborhood()).isEqualTo("boulevard");
    }

    @Test
    void sameTextYieldsEqualFilters() {
        String text = "Cheap sushi in the old city for 8";

        assertThat(extractor.deriveFiltersFromText(text)).isEqualTo(extractor.deriveFiltersFromText(text));
    }

    @Test
    void lowestPriceTierWinsAndStrictnessSticks() {
        DiscoveryFilters filters = extractor.deriveFiltersFromText("upscale but affordable italian");

        assertThat(filters.getMaxPriceRank()).isEqualTo(1);
        assertThat(filters.isStrictBudget()).isTrue();
        assertThat(filters.getCuisines()).containsExactly("italian");
    }

    @Test
    void softPriceWordIsNotStrict() {
        DiscoveryFilters filters = extractor.deriveFiltersFromText("something upscale");

        assertThat(filters.getMaxPriceRank()).isEqualTo(3);
        assertThat(filters.isStrictBudget()).isFalse();
    }

    @Test
    void lastDeclaredNeighborhoodWins() {
        DiscoveryFilters filters = extractor.deriveFiltersFromText("boulevard or maybe old city");

        assertThat(filters.getNeighborhood()).isEqualTo("old_city");
    }

    @Test
    void parsesGroupSize() {
        assertThat(extractor.deriveFiltersFromText("dinner for 8 people").getGroupSize()).isEqualTo(8);
        assertThat(extractor.deriveFiltersFromText("a party of 12").getGroupSize()).isEqualTo(12);
        assertThat(extractor.deriveFiltersFromText("dinner for 8pm").getGroupSize()).isNull();
    }

    @Test
    void textWithoutKeywordsHasNoSignal() {
        DiscoveryFilters filters = extractor.deriveFiltersFromText("surprise me please");

        assertThat(filters.hasSignal()).isFalse();
        assertThat(extractor.deriveFiltersFromText(null).hasSignal()).isFalse();
    }

    @Test
    void summarizesPresentFields() {
        DiscoveryFilters filters = extractor.deriveFiltersFromText("romantic rooftop dinner near the boulevard, not expensive");

        assertThat(extractor.summarize(filters)).isEqualTo("rooftop, romantic • <= tier 1 • boulevard");
        assertThat(extractor.summarize(DiscoveryFilters.none())).isEmpty();
    }
}
