package com.bakureserve.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 자유 텍스트에서 추출한 필터
 * null 필드는 "제약 없음"을 의미 (0이 아님)
 */
@Value
@Builder(toBuilder = true)
public class DiscoveryFilters {

    public static final int GROUP_SIZE_THRESHOLD = 6;

    List<String> cuisines;
    List<String> tags;
    Integer minPriceRank;
    Integer maxPriceRank;
    String neighborhood;
    Integer groupSize;
    boolean strictBudget;

    public static DiscoveryFilters none() {
        return DiscoveryFilters.builder().build();
    }

    public boolean hasCuisines() {
        return cuisines != null && !cuisines.isEmpty();
    }

    public boolean hasTags() {
        return tags != null && !tags.isEmpty();
    }

    public boolean hasNeighborhood() {
        return neighborhood != null;
    }

    public boolean isLargeGroup() {
        return groupSize != null && groupSize >= GROUP_SIZE_THRESHOLD;
    }

    /**
     * 텍스트에 쓸 만한 조건이 하나라도 있었는지
     */
    public boolean hasSignal() {
        return hasCuisines()
                || hasTags()
                || maxPriceRank != null
                || minPriceRank != null
                || hasNeighborhood()
                || groupSize != null;
    }

    /**
     * 제약 하나만 제거한 사본
     */
    public DiscoveryFilters without(RelaxableConstraint constraint) {
        switch (constraint) {
            case NEIGHBORHOOD:
                return toBuilder().neighborhood(null).build();
            case TAGS:
                return toBuilder().tags(null).build();
            case PRICE:
                return toBuilder().maxPriceRank(null).minPriceRank(null).build();
            case CUISINES:
                return toBuilder().cuisines(null).build();
            default:
                throw new IllegalArgumentException("Unknown constraint: " + constraint);
        }
    }
}
