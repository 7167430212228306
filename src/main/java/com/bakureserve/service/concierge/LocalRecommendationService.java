package com.bakureserve.service.concierge;

import com.bakureserve.config.ConciergeProperties;
import com.bakureserve.model.BrowseCategory;
import com.bakureserve.model.ConciergePrompt;
import com.bakureserve.model.DiscoveryFilters;
import com.bakureserve.model.RecommendationResult;
import com.bakureserve.model.RelaxableConstraint;
import com.bakureserve.model.Restaurant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 로컬 매칭 파이프라인 (LOCAL 모드, 원격 랭커 실패 시)
 * Flow: 텍스트 → 필터 → 하드 필터 → 점수 → (제약 하나씩 완화) → 프롬프트 fallback
 */
@Service
public class LocalRecommendationService {

    private static final Logger logger = LoggerFactory.getLogger(LocalRecommendationService.class);

    private final DiscoveryFilterExtractor filterExtractor;
    private final RestaurantScorer scorer;
    private final PromptCatalog promptCatalog;
    private final int minTextLength;

    public LocalRecommendationService(DiscoveryFilterExtractor filterExtractor,
                                      RestaurantScorer scorer,
                                      PromptCatalog promptCatalog,
                                      ConciergeProperties properties) {
        this.filterExtractor = filterExtractor;
        this.scorer = scorer;
        this.promptCatalog = promptCatalog;
        this.minTextLength = properties.getMinTextLength();
    }

    public RecommendationResult recommendForText(String text, List<Restaurant> restaurants, int limit) {
        if (restaurants == null || restaurants.isEmpty() || limit <= 0) {
            return RecommendationResult.empty();
        }

        DiscoveryFilters filters = filterExtractor.deriveFiltersFromText(text);
        boolean hasSignal = filters.hasSignal();
        boolean tooShort = text == null || text.trim().length() < minTextLength;
        logger.info("[LocalRecommendationService] recommendForText - filters: {}, hasSignal: {}", filters, hasSignal);

        if (!hasSignal && tooShort) {
            return RecommendationResult.needsMoreInfo();
        }

        // Step 1: 모든 제약 적용, 가격은 하드 컷
        List<Restaurant> admitted = applyHardFilters(restaurants, filters);
        if (!admitted.isEmpty()) {
            return rankAndSelect(admitted, filters, limit, false);
        }

        // Step 2: 고정 순서로 제약을 하나씩만 제거하며 재시도
        for (RelaxableConstraint constraint : RelaxableConstraint.dropOrder(filters.isStrictBudget())) {
            if (!isPresent(filters, constraint)) {
                continue;
            }
            List<Restaurant> pool = applyHardFilters(restaurants, filters.without(constraint));
            logger.info("[LocalRecommendationService] relaxed {} - pool: {}", constraint, pool.size());
            if (!pool.isEmpty()) {
                return rankAndSelect(pool, filters, limit, true);
            }
        }

        // Step 3: 후보 없음, 신호 없는 입력이면 추측하지 않음
        if (!hasSignal) {
            return RecommendationResult.needsMoreInfo();
        }
        ConciergePrompt prompt = promptCatalog.pickPromptForText(text);
        logger.info("[LocalRecommendationService] relaxation exhausted, falling back to prompt: {}", prompt.getId());
        return RecommendationResult.builder()
                .items(recommendForPrompt(prompt, restaurants, limit))
                .relaxed(true)
                .build();
    }

    /**
     * 프롬프트 선호도로 정렬
     * 후보가 있으면 절대 비지 않음 (카테고리 매칭 → 앞쪽 레코드 순으로 fallback)
     */
    public List<Restaurant> recommendForPrompt(ConciergePrompt prompt, List<Restaurant> restaurants, int limit) {
        if (restaurants == null || restaurants.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<ScoredRestaurant> scored = new ArrayList<>();
        for (int i = 0; i < restaurants.size(); i++) {
            Restaurant restaurant = restaurants.get(i);
            scored.add(new ScoredRestaurant(restaurant, scorer.scoreForPrompt(restaurant, prompt, i)));
        }
        List<Restaurant> top = selectTop(scored, limit);
        if (!top.isEmpty()) {
            return top;
        }

        if (prompt.getCategoryId() != null) {
            List<Restaurant> byCategory = BrowseCategory.fromId(prompt.getCategoryId())
                    .map(category -> restaurants.stream().filter(category::matches).collect(Collectors.toList()))
                    .orElse(List.of());
            if (!byCategory.isEmpty()) {
                return distinctById(byCategory, limit);
            }
        }
        return distinctById(restaurants, limit);
    }

    /**
     * 하드 필터 (현재 제약을 모두 통과하는 후보)
     */
    List<Restaurant> applyHardFilters(List<Restaurant> restaurants, DiscoveryFilters filters) {
        return restaurants.stream()
                .filter(restaurant -> admits(restaurant, filters))
                .collect(Collectors.toList());
    }

    private boolean admits(Restaurant restaurant, DiscoveryFilters filters) {
        if (filters.hasCuisines() && filters.getCuisines().stream().noneMatch(restaurant::hasCuisineLike)) {
            return false;
        }
        if (filters.hasTags() && filters.getTags().stream().noneMatch(restaurant::hasTagLike)) {
            return false;
        }
        if (filters.getMaxPriceRank() != null || filters.getMinPriceRank() != null) {
            Integer tier = restaurant.getPriceTier();
            if (tier == null) {
                // strict 예산: 가격 미상은 저렴한 것으로 보지 않음
                if (filters.isStrictBudget() && filters.getMaxPriceRank() != null) {
                    return false;
                }
            } else {
                if (filters.getMaxPriceRank() != null && tier > filters.getMaxPriceRank()) {
                    return false;
                }
                if (filters.getMinPriceRank() != null && tier < filters.getMinPriceRank()) {
                    return false;
                }
            }
        }
        // 동네 정보가 없는 레코드는 제외하지 않음
        if (filters.hasNeighborhood() && restaurant.getNeighborhood() != null
                && !restaurant.isInNeighborhood(filters.getNeighborhood())) {
            return false;
        }
        if (filters.isLargeGroup() && !RestaurantScorer.hasGroupTag(restaurant)) {
            return false;
        }
        return true;
    }

    private RecommendationResult rankAndSelect(List<Restaurant> pool, DiscoveryFilters filters, int limit, boolean relaxed) {
        List<ScoredRestaurant> scored = new ArrayList<>();
        for (int i = 0; i < pool.size(); i++) {
            Restaurant restaurant = pool.get(i);
            scored.add(new ScoredRestaurant(restaurant, scorer.scoreForFilters(restaurant, filters, i)));
        }
        String summary = filterExtractor.summarize(filters);
        return RecommendationResult.builder()
                .items(selectTop(scored, limit))
                .summary(summary.isEmpty() ? null : summary)
                .relaxed(relaxed)
                .build();
    }

    private static boolean isPresent(DiscoveryFilters filters, RelaxableConstraint constraint) {
        switch (constraint) {
            case NEIGHBORHOOD:
                return filters.hasNeighborhood();
            case TAGS:
                return filters.hasTags();
            case PRICE:
                return filters.getMaxPriceRank() != null || filters.getMinPriceRank() != null;
            case CUISINES:
                return filters.hasCuisines();
            default:
                return false;
        }
    }

    // 안정 정렬: 동점이면 입력 순서 유지
    private static List<Restaurant> selectTop(List<ScoredRestaurant> scored, int limit) {
        List<ScoredRestaurant> sorted = new ArrayList<>(scored);
        sorted.sort(Comparator.comparingDouble(ScoredRestaurant::getScore).reversed());
        List<Restaurant> positive = sorted.stream()
                .filter(entry -> entry.getScore() > 0)
                .map(ScoredRestaurant::getRestaurant)
                .collect(Collectors.toList());
        return distinctById(positive, limit);
    }

    private static List<Restaurant> distinctById(List<Restaurant> restaurants, int limit) {
        Set<String> seen = new HashSet<>();
        List<Restaurant> result = new ArrayList<>();
        for (Restaurant restaurant : restaurants) {
            if (result.size() >= limit) {
                break;
            }
            if (seen.add(restaurant.getId())) {
                result.add(restaurant);
            }
        }
        return result;
    }

    private static class ScoredRestaurant {
        private final Restaurant restaurant;
        private final double score;

        ScoredRestaurant(Restaurant restaurant, double score) {
            this.restaurant = restaurant;
            this.score = score;
        }

        Restaurant getRestaurant() {
            return restaurant;
        }

        double getScore() {
            return score;
        }
    }
}
