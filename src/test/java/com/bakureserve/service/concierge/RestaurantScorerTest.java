package com.bakureserve.service.concierge;

import com.bakureserve.model.DiscoveryFilters;
import com.bakureserve.model.Restaurant;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bakureserve.fixtures.RestaurantFixtures.restaurant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RestaurantScorerTest {

    private final RestaurantScorer scorer = new RestaurantScorer();
    private final PromptCatalog catalog = new PromptCatalog();

    @Test
    void overBudgetScoreIsClampedAtZero() {
        Restaurant pricey = restaurant("lux", "Lux", List.of(), List.of(), null, "AZN 4/4", null);
        DiscoveryFilters cheap = DiscoveryFilters.builder().maxPriceRank(1).strictBudget(true).build();

        assertThat(scorer.scoreForFilters(pricey, cheap, 100)).isEqualTo(0.0);
    }

    @Test
    void scoresAreNeverNegative() {
        Restaurant pricey = restaurant("lux", "Lux", List.of("French"), List.of("quiet"), "Nizami", "AZN 4/4", 0.0);
        List<DiscoveryFilters> variants = List.of(
                DiscoveryFilters.none(),
                DiscoveryFilters.builder().maxPriceRank(1).build(),
                DiscoveryFilters.builder().maxPriceRank(2).tags(List.of("rooftop")).cuisines(List.of("sushi")).build(),
                DiscoveryFilters.builder().groupSize(10).neighborhood("bilgah").build());

        for (DiscoveryFilters filters : variants) {
            for (int index = 0; index < 120; index += 7) {
                assertThat(scorer.scoreForFilters(pricey, filters, index)).isGreaterThanOrEqualTo(0.0);
            }
        }
        catalog.getPrompts().forEach(prompt ->
                assertThat(scorer.scoreForPrompt(pricey, prompt, 200)).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    void cheaperWithinBudgetRanksHigher() {
        DiscoveryFilters filters = DiscoveryFilters.builder().maxPriceRank(3).build();
        Restaurant cheap = restaurant("a", "A", List.of(), List.of(), null, "AZN 1/4", null);
        Restaurant mid = restaurant("b", "B", List.of(), List.of(), null, "AZN 3/4", null);

        double difference = scorer.scoreForFilters(cheap, filters, 0) - scorer.scoreForFilters(mid, filters, 0);

        assertThat(difference).isCloseTo(2.4, within(1e-9));
    }

    @Test
    void tieBreakFavorsEarlierRecords() {
        Restaurant plain = restaurant("a", "A", List.of(), List.of(), null, null, null);

        assertThat(scorer.scoreForFilters(plain, DiscoveryFilters.none(), 0)).isEqualTo(2.0);
        assertThat(scorer.scoreForFilters(plain, DiscoveryFilters.none(), 10)).isCloseTo(1.7, within(1e-9));
        assertThat(scorer.scoreForFilters(plain, DiscoveryFilters.none(), 1000)).isEqualTo(0.0);
    }

    @Test
    void filterMatchesAddUp() {
        Restaurant match = restaurant("m", "M", List.of("Japanese", "Sushi"), List.of("rooftop", "romantic"),
                "Old City", "AZN 2/4", 5.0);
        DiscoveryFilters filters = DiscoveryFilters.builder()
                .cuisines(List.of("sushi"))
                .tags(List.of("rooftop", "romantic"))
                .neighborhood("old_city")
                .maxPriceRank(2)
                .build();

        // cuisine 3.5 + tags 6 + neighborhood 2 + budget 3 + rating 3 + tie-break 2
        assertThat(scorer.scoreForFilters(match, filters, 0)).isCloseTo(19.5, within(1e-9));
    }

    @Test
    void largeGroupRewardsGroupFriendlyTags() {
        Restaurant family = restaurant("f", "F", List.of(), List.of("group_dining"), null, null, null);
        Restaurant intimate = restaurant("i", "I", List.of(), List.of("quiet"), null, null, null);
        DiscoveryFilters group = DiscoveryFilters.builder().groupSize(8).build();

        assertThat(scorer.scoreForFilters(family, group, 0) - scorer.scoreForFilters(intimate, group, 0))
                .isCloseTo(2.0, within(1e-9));
    }

    @Test
    void romanticViewsPromptPrefersUpscaleRooftops() {
        Restaurant upscale = restaurant("u", "U", List.of(), List.of("rooftop"), null, "AZN 4/4", null);
        Restaurant casual = restaurant("c", "C", List.of(), List.of("rooftop"), null, "AZN 2/4", null);

        double difference = scorer.scoreForPrompt(upscale, catalog.findPromptById("romantic_views").orElseThrow(), 0)
                - scorer.scoreForPrompt(casual, catalog.findPromptById("romantic_views").orElseThrow(), 0);

        assertThat(difference).isCloseTo(1.5, within(1e-9));
    }
}
