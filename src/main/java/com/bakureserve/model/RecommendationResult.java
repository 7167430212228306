package com.bakureserve.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RecommendationResult {
    @Builder.Default
    List<Restaurant> items = List.of();
    String summary;
    boolean relaxed;
    boolean needsMoreInfo;
    @Builder.Default
    RecommendationSource source = RecommendationSource.LOCAL;
    /** 원격 랭커가 내려준 안내 문구 (없으면 null) */
    String message;

    public static RecommendationResult empty() {
        return RecommendationResult.builder().build();
    }

    public static RecommendationResult needsMoreInfo() {
        return RecommendationResult.builder().needsMoreInfo(true).build();
    }
}
