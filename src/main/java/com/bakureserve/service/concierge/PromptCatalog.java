package com.bakureserve.service.concierge;

import com.bakureserve.model.ConciergePrompt;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 큐레이션 프롬프트 목록 (표시 순서, 변경 없음)
 */
@Component
public class PromptCatalog {

    public static final ConciergePrompt DEFAULT_PROMPT = ConciergePrompt.builder()
            .id("bespoke")
            .title("Curate something for me")
            .subtitle("Tell me mood, cuisine, or budget.")
            .responseHint("Here are versatile crowd-pleasers to get you started.")
            .build();

    private static final int CURATED_CHIP_COUNT = 6;
    private static final int KEYWORD_HIT_SCORE = 2;

    private static final List<ConciergePrompt> PROMPTS = List.of(
            ConciergePrompt.builder()
                    .id("romantic_views")
                    .title("Date night with a view")
                    .subtitle("Rooftops, sunsets, wine-forward lists.")
                    .keywords(List.of("date", "romantic", "anniversary", "proposal", "view", "skyline", "rooftop", "sunset"))
                    .categoryId("rooftop_views")
                    .tags(List.of("romantic", "sunset", "rooftop", "skyline", "sea_view", "terrace"))
                    .responseHint("Here are skyline spots with soft lighting and great wine service.")
                    .build(),
            ConciergePrompt.builder()
                    .id("group_celebration")
                    .title("Group dinner for 6-10")
                    .subtitle("Spacious tables, lively rooms, easy splits.")
                    .keywords(List.of("group", "birthday", "team", "friends", "celebration", "party", "large table", "big table"))
                    .categoryId("family_friendly")
                    .tags(List.of("group_dining", "family", "birthday", "celebration", "private_room"))
                    .responseHint("These venues handle bigger parties without sacrificing vibe.")
                    .build(),
            ConciergePrompt.builder()
                    .id("live_music")
                    .title("Cocktails & live music")
                    .subtitle("DJs, bands, and late-night energy.")
                    .keywords(List.of("music", "dj", "band", "vinyl", "late night", "dance"))
                    .categoryId("live_music")
                    .tags(List.of("live_music", "dj", "late_night", "cocktails", "vinyl"))
                    .responseHint("High-energy rooms with strong bar programs.")
                    .build(),
            ConciergePrompt.builder()
                    .id("chef_table")
                    .title("Chef's tasting menus")
                    .subtitle("Open kitchens, limited seats.")
                    .keywords(List.of("chef", "tasting", "omakase", "degustation", "course", "fine dining"))
                    .categoryId("chef_table")
                    .tags(List.of("chef_table", "tasting_menu", "open_kitchen", "chef_counter"))
                    .responseHint("Intimate kitchens and tasting menus worth dressing up for.")
                    .build(),
            ConciergePrompt.builder()
                    .id("seaside")
                    .title("Seafood on the water")
                    .subtitle("Caspian views, grilled fish, chilled whites.")
                    .keywords(List.of("seafood", "fish", "caviar", "oyster", "sea", "waterfront", "boulevard"))
                    .tags(List.of("seafood", "waterfront", "sea_view", "seaside", "sunset"))
                    .responseHint("Waterfront picks with reliable seafood programs.")
                    .build(),
            ConciergePrompt.builder()
                    .id("brunch")
                    .title("Sunny brunch & coffee")
                    .subtitle("Patios, pour-overs, pastries.")
                    .keywords(List.of("brunch", "coffee", "breakfast", "pastry", "cafe"))
                    .categoryId("cafes_breakfast")
                    .tags(List.of("brunch", "breakfast", "cafe", "coffee"))
                    .responseHint("Bright daytime spots with good coffee and airy seating.")
                    .build(),
            ConciergePrompt.builder()
                    .id("cocktails")
                    .title("Designer cocktails")
                    .subtitle("Mixology bars, dim lights, late hours.")
                    .keywords(List.of("cocktail", "bar", "negroni", "mezcal", "martini", "speakeasy"))
                    .categoryId("bars_lounges")
                    .tags(List.of("cocktails", "bar", "mixology", "late_night"))
                    .responseHint("Bartender-driven rooms for an elevated nightcap.")
                    .build()
    );

    public List<ConciergePrompt> getPrompts() {
        return PROMPTS;
    }

    /**
     * 칩으로 노출할 앞쪽 6개
     */
    public List<ConciergePrompt> getCuratedPrompts() {
        return PROMPTS.subList(0, Math.min(CURATED_CHIP_COUNT, PROMPTS.size()));
    }

    /**
     * id로 프롬프트 조회 (기본 프롬프트 포함)
     */
    public Optional<ConciergePrompt> findPromptById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        if (DEFAULT_PROMPT.getId().equals(id)) {
            return Optional.of(DEFAULT_PROMPT);
        }
        return PROMPTS.stream().filter(prompt -> prompt.getId().equals(id)).findFirst();
    }

    /**
     * 텍스트에 가장 잘 맞는 프롬프트 선택
     * 키워드 포함 시 +2, 동점이면 카탈로그 순서, 하나도 없으면 {@link #DEFAULT_PROMPT}
     */
    public ConciergePrompt pickPromptForText(String text) {
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        ConciergePrompt best = DEFAULT_PROMPT;
        int bestScore = 0;

        for (ConciergePrompt prompt : PROMPTS) {
            int score = 0;
            for (String keyword : prompt.getKeywords()) {
                if (normalized.contains(keyword)) {
                    score += KEYWORD_HIT_SCORE;
                }
            }
            if (score > bestScore) {
                bestScore = score;
                best = prompt;
            }
        }
        return best;
    }
}
