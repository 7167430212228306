package com.bakureserve.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 큐레이션된 탐색 프롬프트 ("Date night with a view")
 * 트리거 키워드와 카테고리/태그/요리 선호도를 가짐
 */
@Value
@Builder
public class ConciergePrompt {
    String id;
    String title;
    String subtitle;
    @Builder.Default
    List<String> keywords = List.of();
    String categoryId;
    @Builder.Default
    List<String> tags = List.of();
    @Builder.Default
    List<String> cuisines = List.of();
    String responseHint;

    public boolean hasResponseHint() {
        return responseHint != null && !responseHint.isBlank();
    }
}
