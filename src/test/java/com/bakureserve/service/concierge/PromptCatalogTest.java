package com.bakureserve.service.concierge;

import com.bakureserve.model.ConciergePrompt;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class PromptCatalogTest {

    private final PromptCatalog catalog = new PromptCatalog();

    @Test
    void curatedPromptsAreTheFirstSixInOrder() {
        assertThat(catalog.getCuratedPrompts())
                .extracting(ConciergePrompt::getId)
                .containsExactly("romantic_views", "group_celebration", "live_music", "chef_table", "seaside", "brunch");
    }

    @Test
    void promptIdsAreUnique() {
        assertThat(catalog.getPrompts().stream().map(ConciergePrompt::getId).collect(Collectors.toSet()))
                .hasSize(catalog.getPrompts().size());
    }

    @Test
    void findsPromptsIncludingDefault() {
        assertThat(catalog.findPromptById("cocktails")).isPresent();
        assertThat(catalog.findPromptById("bespoke")).contains(PromptCatalog.DEFAULT_PROMPT);
        assertThat(catalog.findPromptById("nope")).isEmpty();
        assertThat(catalog.findPromptById(null)).isEmpty();
    }

    @Test
    void picksPromptWithMostKeywordHits() {
        assertThat(catalog.pickPromptForText("Anniversary dinner with a sunset view").getId()).isEqualTo("romantic_views");
        assertThat(catalog.pickPromptForText("oysters and caviar by the sea").getId()).isEqualTo("seaside");
    }

    @Test
    void tieKeepsCatalogOrder() {
        // "date" and "music" score one hit each
        assertThat(catalog.pickPromptForText("date with music").getId()).isEqualTo("romantic_views");
    }

    @Test
    void noHitFallsBackToDefault() {
        assertThat(catalog.pickPromptForText("hmm")).isSameAs(PromptCatalog.DEFAULT_PROMPT);
        assertThat(catalog.pickPromptForText(null)).isSameAs(PromptCatalog.DEFAULT_PROMPT);
    }
}
