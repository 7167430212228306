package com.bakureserve.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 예약 가능한 식당 (디렉터리가 제공하는 읽기 전용 레코드)
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Restaurant {

    private static final Pattern PRICE_DIGIT = Pattern.compile("(\\d)");

    String id;
    String name;
    @Builder.Default
    List<String> cuisine = List.of();
    @Builder.Default
    List<String> tags = List.of();
    String neighborhood;
    String address;
    String priceLevel; // "AZN 2/4", "$$"
    Double rating; // 0.0-5.0
    String instagram;
    String website;
    String shortDescription;

    /**
     * 가격 라벨에서 가격 등급 추출 (1 = 가장 저렴, 4 = 가장 비쌈)
     * 라벨이 없거나 해석할 수 없으면 null
     */
    public Integer getPriceTier() {
        if (priceLevel == null || priceLevel.isBlank()) {
            return null;
        }
        Matcher matcher = PRICE_DIGIT.matcher(priceLevel);
        if (matcher.find()) {
            int tier = Integer.parseInt(matcher.group(1));
            return tier >= 1 && tier <= 4 ? tier : null;
        }
        // "$", "$$", "$$$"
        if (priceLevel.contains("$")) {
            int count = (int) priceLevel.chars().filter(c -> c == '$').count();
            return Math.min(count, 4);
        }
        return null;
    }

    /**
     * 느슨한 태그 매칭 (정확히 일치하거나 부분 문자열 포함)
     */
    public boolean hasTagLike(String tag) {
        String needle = tag.toLowerCase(Locale.ROOT);
        return normalized(tags).stream().anyMatch(entry -> entry.equals(needle) || entry.contains(needle));
    }

    /**
     * 정확한 태그 매칭
     */
    public boolean hasAnyTag(Collection<String> candidates) {
        List<String> haystack = normalized(tags);
        return candidates.stream().anyMatch(tag -> haystack.contains(tag.toLowerCase(Locale.ROOT)));
    }

    public boolean hasCuisineLike(String cuisineKeyword) {
        String needle = cuisineKeyword.toLowerCase(Locale.ROOT);
        return normalized(cuisine).stream().anyMatch(entry -> entry.contains(needle));
    }

    /**
     * 동네 id의 "_"는 공백으로 바꿔 비교 (old_city -> "old city")
     */
    public boolean isInNeighborhood(String neighborhoodId) {
        if (neighborhood == null || neighborhoodId == null) {
            return false;
        }
        return neighborhood.toLowerCase(Locale.ROOT).contains(neighborhoodId.replace('_', ' '));
    }

    private static List<String> normalized(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(value -> value != null)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }
}
