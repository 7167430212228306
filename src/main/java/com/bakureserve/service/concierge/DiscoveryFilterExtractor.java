package com.bakureserve.service.concierge;

import com.bakureserve.model.DiscoveryFilters;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 고정된 영어 키워드 사전으로 자유 텍스트를 {@link DiscoveryFilters}로 변환
 * 순수 함수: 같은 텍스트는 항상 같은 필터
 */
@Component
public class DiscoveryFilterExtractor {

    static final Pattern GROUP_SIZE = Pattern.compile("\\b(for|party of)\\s*(\\d{1,2})\\b");

    private static final Map<String, PriceWord> PRICE_WORDS = new LinkedHashMap<>();
    private static final List<String> CUISINE_KEYWORDS = List.of(
            "italian", "japanese", "sushi", "seafood", "steak", "azerbaijani", "local", "mediterranean",
            "turkish", "indian", "thai", "chinese", "burger", "bbq", "vegan", "vegetarian", "brunch", "cafe");
    private static final Map<String, List<String>> TAG_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<String>> NEIGHBORHOOD_KEYWORDS = new LinkedHashMap<>();

    static {
        PRICE_WORDS.put("cheap", new PriceWord(1, true));
        PRICE_WORDS.put("budget", new PriceWord(1, true));
        PRICE_WORDS.put("low budget", new PriceWord(1, true));
        PRICE_WORDS.put("affordable", new PriceWord(1, true));
        PRICE_WORDS.put("inexpensive", new PriceWord(1, true));
        PRICE_WORDS.put("not expensive", new PriceWord(1, true));
        PRICE_WORDS.put("casual", new PriceWord(2, false));
        PRICE_WORDS.put("moderate", new PriceWord(2, false));
        PRICE_WORDS.put("mid", new PriceWord(2, false));
        PRICE_WORDS.put("$$", new PriceWord(2, false));
        PRICE_WORDS.put("reasonable", new PriceWord(2, false));
        PRICE_WORDS.put("upscale", new PriceWord(3, false));
        PRICE_WORDS.put("expensive", new PriceWord(4, false));
        PRICE_WORDS.put("premium", new PriceWord(4, false));
        PRICE_WORDS.put("luxury", new PriceWord(4, false));

        TAG_KEYWORDS.put("rooftop", List.of("rooftop", "skyline", "view", "sunset", "terrace", "panorama"));
        TAG_KEYWORDS.put("romantic", List.of("date", "romantic", "anniversary", "candlelight", "proposal"));
        TAG_KEYWORDS.put("live_music", List.of("live music", "dj", "band", "vinyl", "performance"));
        TAG_KEYWORDS.put("cocktails", List.of("cocktail", "mixology", "bar", "negroni", "martini"));
        TAG_KEYWORDS.put("brunch", List.of("brunch", "breakfast", "daytime", "coffee", "pastry"));
        TAG_KEYWORDS.put("seafood", List.of("seafood", "fish", "caviar", "oyster", "lobster"));
        TAG_KEYWORDS.put("family", List.of("family", "kids", "group", "birthday", "celebration"));
        TAG_KEYWORDS.put("vegan", List.of("vegan", "vegetarian", "plant"));
        TAG_KEYWORDS.put("quiet", List.of("quiet", "calm", "business", "meeting"));
        // "boulevard"는 분위기가 아니라 동네
        TAG_KEYWORDS.put("waterfront", List.of("waterfront", "sea", "seaside"));

        NEIGHBORHOOD_KEYWORDS.put("boulevard", List.of("boulevard", "seaside", "waterfront"));
        NEIGHBORHOOD_KEYWORDS.put("nizami", List.of("nizami", "torgovy"));
        NEIGHBORHOOD_KEYWORDS.put("old_city", List.of("icheri", "old city", "walled"));
        NEIGHBORHOOD_KEYWORDS.put("port_baku", List.of("port baku", "portbaku", "port-baku"));
        NEIGHBORHOOD_KEYWORDS.put("sea_breeze", List.of("sea breeze", "seabreeze", "nardaran"));
        NEIGHBORHOOD_KEYWORDS.put("white_city", List.of("white city", "agh seher", "ag seher"));
        NEIGHBORHOOD_KEYWORDS.put("ganjlik", List.of("ganjlik", "gənclik", "ganclik"));
        NEIGHBORHOOD_KEYWORDS.put("narimanov", List.of("narimanov", "narminov"));
        NEIGHBORHOOD_KEYWORDS.put("bayil", List.of("bayil", "flag square"));
        NEIGHBORHOOD_KEYWORDS.put("shikhov", List.of("shikhov", "bibiheybat", "bibi heybat"));
        NEIGHBORHOOD_KEYWORDS.put("bilgah", List.of("bilgah", "bilgeh"));
    }

    /**
     * 텍스트에서 가격/요리/태그/동네/인원 추출
     */
    public DiscoveryFilters deriveFiltersFromText(String text) {
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        DiscoveryFilters.DiscoveryFiltersBuilder filters = DiscoveryFilters.builder();

        // 가격: 가장 낮은 등급 채택, strict는 한 번 걸리면 유지
        Integer maxPriceRank = null;
        boolean strictBudget = false;
        for (Map.Entry<String, PriceWord> entry : PRICE_WORDS.entrySet()) {
            if (normalized.contains(entry.getKey())) {
                PriceWord word = entry.getValue();
                maxPriceRank = maxPriceRank == null ? word.tier : Math.min(maxPriceRank, word.tier);
                strictBudget = strictBudget || word.strict;
            }
        }
        filters.maxPriceRank(maxPriceRank).strictBudget(strictBudget);

        List<String> cuisines = new ArrayList<>();
        for (String cuisine : CUISINE_KEYWORDS) {
            if (normalized.contains(cuisine)) {
                cuisines.add(cuisine);
            }
        }
        if (!cuisines.isEmpty()) {
            filters.cuisines(List.copyOf(cuisines));
        }

        List<String> tags = new ArrayList<>();
        for (Map.Entry<String, List<String>> group : TAG_KEYWORDS.entrySet()) {
            if (containsAny(normalized, group.getValue())) {
                tags.add(group.getKey());
            }
        }
        if (!tags.isEmpty()) {
            filters.tags(List.copyOf(tags));
        }

        // 여러 동네가 언급되면 마지막으로 선언된 그룹 채택
        String neighborhood = null;
        for (Map.Entry<String, List<String>> group : NEIGHBORHOOD_KEYWORDS.entrySet()) {
            if (containsAny(normalized, group.getValue())) {
                neighborhood = group.getKey();
            }
        }
        filters.neighborhood(neighborhood);

        Matcher size = GROUP_SIZE.matcher(normalized);
        if (size.find()) {
            filters.groupSize(Integer.parseInt(size.group(2)));
        }

        return filters.build();
    }

    /**
     * 필터 요약 라벨 (예: {@code "sushi • rooftop, romantic • <= tier 2 • old city"})
     */
    public String summarize(DiscoveryFilters filters) {
        List<String> parts = new ArrayList<>();
        if (filters.hasCuisines()) {
            parts.add(String.join(", ", filters.getCuisines()));
        }
        if (filters.hasTags()) {
            parts.add(String.join(", ", filters.getTags()));
        }
        if (filters.getMaxPriceRank() != null) {
            parts.add("<= tier " + filters.getMaxPriceRank());
        }
        if (filters.hasNeighborhood()) {
            parts.add(filters.getNeighborhood().replace('_', ' '));
        }
        return String.join(" • ", parts);
    }

    /** 키워드 중 하나라도 포함되는지 */
    private static boolean containsAny(String text, List<String> words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static final class PriceWord {
        private final int tier;
        private final boolean strict;

        private PriceWord(int tier, boolean strict) {
            this.tier = tier;
            this.strict = strict;
        }
    }
}
