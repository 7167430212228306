package com.bakureserve.service.concierge;

import com.bakureserve.config.ConciergeProperties;
import com.bakureserve.dto.remote.RemoteConciergeResponse;
import com.bakureserve.dto.remote.RemoteConciergeResult;
import com.bakureserve.model.ConciergeMode;
import com.bakureserve.model.ConciergePrompt;
import com.bakureserve.model.RecommendationResult;
import com.bakureserve.model.RecommendationSource;
import com.bakureserve.model.Restaurant;
import com.bakureserve.service.remote.RemoteConciergeClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 원격 우선, 실패 시 로컬 디스패치
 * AI 모드는 질의마다 원격 호출을 한 번 시도하고, 실패하면 같은 발화로 {@link LocalRecommendationService} 실행
 * LOCAL 모드는 원격 호출을 하지 않음
 */
@Service
public class HybridConciergeDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(HybridConciergeDispatcher.class);

    private final ConciergeMode mode;
    private final RemoteConciergeClient remoteClient;
    private final LocalRecommendationService localRecommendationService;

    public HybridConciergeDispatcher(ConciergeProperties properties,
                                     RemoteConciergeClient remoteClient,
                                     LocalRecommendationService localRecommendationService) {
        this.mode = properties.resolveMode();
        this.remoteClient = remoteClient;
        this.localRecommendationService = localRecommendationService;
        logger.info("[HybridConciergeDispatcher] concierge mode resolved: {}", mode);
    }

    public ConciergeMode getMode() {
        return mode;
    }

    public RecommendationResult dispatchDiscovery(String text, List<Restaurant> restaurants, int limit) {
        if (mode == ConciergeMode.AI) {
            try {
                return fetchRemote(text, limit);
            } catch (RuntimeException e) {
                logger.warn("[HybridConciergeDispatcher] remote discovery failed, falling back to local: {}", e.getMessage());
            }
        }
        return localRecommendationService.recommendForText(text, restaurants, limit);
    }

    /**
     * @param utterance 사용자 원문 (칩을 누른 경우 프롬프트 제목)
     */
    public RecommendationResult dispatchPrompt(ConciergePrompt prompt, String utterance,
                                               List<Restaurant> restaurants, int limit) {
        if (mode == ConciergeMode.AI) {
            try {
                return fetchRemote(utterance, limit);
            } catch (RuntimeException e) {
                logger.warn("[HybridConciergeDispatcher] remote prompt {} failed, falling back to local: {}",
                        prompt.getId(), e.getMessage());
            }
        }
        return RecommendationResult.builder()
                .items(localRecommendationService.recommendForPrompt(prompt, restaurants, limit))
                .build();
    }

    private RecommendationResult fetchRemote(String text, int limit) {
        RemoteConciergeResponse response = remoteClient.fetchConcierge(text, limit);
        return RecommendationResult.builder()
                .items(mapResults(response.getResults(), limit))
                .message(response.getMessage())
                .source(RecommendationSource.REMOTE)
                .build();
    }

    /**
     * 원격 결과를 Restaurant로 변환 (중복 id 제거, limit 적용)
     */
    private static List<Restaurant> mapResults(List<RemoteConciergeResult> results, int limit) {
        Set<String> seen = new HashSet<>();
        List<Restaurant> restaurants = new ArrayList<>();
        for (RemoteConciergeResult result : results) {
            if (restaurants.size() >= limit) {
                break;
            }
            if (!seen.add(result.getId())) {
                continue;
            }
            restaurants.add(Restaurant.builder()
                    .id(result.getId())
                    .name(result.getName())
                    .neighborhood(result.getArea())
                    .address(result.getAddress())
                    .priceLevel(result.getPriceLabel())
                    .tags(result.getTags() != null ? List.copyOf(result.getTags()) : List.of())
                    .instagram(result.getInstagram())
                    .shortDescription(result.getSummary())
                    .website(result.getWebsite())
                    .build());
        }
        return restaurants;
    }
}
