package com.bakureserve.service.concierge;

import com.bakureserve.model.BrowseCategory;
import com.bakureserve.model.ConciergePrompt;
import com.bakureserve.model.DiscoveryFilters;
import com.bakureserve.model.Restaurant;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 키워드 선호도 점수 계산
 * 두 진입점 모두 0 이상의 점수를 반환, {@code index}는 후보 목록 내 위치 (동점 처리 가산점에만 사용)
 */
@Component
public class RestaurantScorer {

    static final List<String> GROUP_TAGS = List.of("group_dining", "family", "birthday", "private_room", "celebration");

    private static final double CATEGORY_WEIGHT = 6.0;
    private static final double TAG_WEIGHT = 3.0;
    private static final double PROMPT_CUISINE_WEIGHT = 2.0;
    private static final double FILTER_CUISINE_WEIGHT = 3.5;
    private static final double NEIGHBORHOOD_WEIGHT = 2.0;
    private static final double GROUP_WEIGHT = 2.0;
    private static final double WITHIN_BUDGET_WEIGHT = 3.0;
    private static final double OVER_BUDGET_PENALTY = 4.0;
    private static final double CHEAPER_STEP_WEIGHT = 1.2;
    private static final double PROMPT_RATING_WEIGHT = 0.8;
    private static final double FILTER_RATING_WEIGHT = 0.6;
    private static final double ROMANTIC_UPSCALE_BONUS = 1.5;

    private static final double TIE_BREAK_BASE = 2.0;
    private static final double TIE_BREAK_STEP = 0.03;

    /**
     * 프롬프트 기준 점수
     */
    public double scoreForPrompt(Restaurant restaurant, ConciergePrompt prompt, int index) {
        double score = 0;

        if (prompt.getCategoryId() != null) {
            boolean inCategory = BrowseCategory.fromId(prompt.getCategoryId())
                    .map(category -> category.matches(restaurant))
                    .orElse(false);
            if (inCategory) {
                score += CATEGORY_WEIGHT;
            }
        }

        for (String tag : prompt.getTags()) {
            if (restaurant.hasTagLike(tag)) {
                score += TAG_WEIGHT;
            }
        }

        for (String cuisine : prompt.getCuisines()) {
            if (restaurant.hasCuisineLike(cuisine)) {
                score += PROMPT_CUISINE_WEIGHT;
            }
        }

        Integer tier = restaurant.getPriceTier();
        if ("romantic_views".equals(prompt.getId()) && tier != null && tier >= 3) {
            score += ROMANTIC_UPSCALE_BONUS;
        }

        score += ratingContribution(restaurant, PROMPT_RATING_WEIGHT);
        score += tieBreak(index);
        return Math.max(0, score);
    }

    /**
     * 필터 기준 점수
     */
    public double scoreForFilters(Restaurant restaurant, DiscoveryFilters filters, int index) {
        double score = 0;

        if (filters.hasCuisines()) {
            for (String cuisine : filters.getCuisines()) {
                if (restaurant.hasCuisineLike(cuisine)) {
                    score += FILTER_CUISINE_WEIGHT;
                }
            }
        }

        if (filters.hasTags()) {
            for (String tag : filters.getTags()) {
                if (restaurant.hasTagLike(tag)) {
                    score += TAG_WEIGHT;
                }
            }
        }

        if (filters.hasNeighborhood() && restaurant.isInNeighborhood(filters.getNeighborhood())) {
            score += NEIGHBORHOOD_WEIGHT;
        }

        Integer tier = restaurant.getPriceTier();
        Integer maxTier = filters.getMaxPriceRank();
        if (maxTier != null && tier != null) {
            if (tier <= maxTier) {
                score += WITHIN_BUDGET_WEIGHT;
                // 상한보다 저렴할수록 가산
                score += CHEAPER_STEP_WEIGHT * (maxTier - tier);
            } else {
                score -= OVER_BUDGET_PENALTY;
            }
        }

        if (filters.isLargeGroup() && hasGroupTag(restaurant)) {
            score += GROUP_WEIGHT;
        }

        score += ratingContribution(restaurant, FILTER_RATING_WEIGHT);
        score += tieBreak(index);
        return Math.max(0, score);
    }

    static boolean hasGroupTag(Restaurant restaurant) {
        return GROUP_TAGS.stream().anyMatch(restaurant::hasTagLike);
    }

    private static double ratingContribution(Restaurant restaurant, double weight) {
        Double rating = restaurant.getRating();
        if (rating == null) {
            return 0;
        }
        return Math.max(0, Math.min(rating, 5.0)) * weight;
    }

    /**
     * 앞쪽 레코드에 작은 가산점 (동점 시 입력 순서 유지)
     */
    private static double tieBreak(int index) {
        return Math.max(0, TIE_BREAK_BASE - TIE_BREAK_STEP * index);
    }
}
