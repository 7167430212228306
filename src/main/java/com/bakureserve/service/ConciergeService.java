package com.bakureserve.service;

import com.bakureserve.config.ConciergeProperties;
import com.bakureserve.dto.response.ConciergeReplyResponse;
import com.bakureserve.dto.response.ConciergeSessionResponse;
import com.bakureserve.exception.ConciergeNotFoundException;
import com.bakureserve.model.BookingIntent;
import com.bakureserve.model.ConciergeMessage;
import com.bakureserve.model.ConciergeMode;
import com.bakureserve.model.ConciergePrompt;
import com.bakureserve.model.RecommendationResult;
import com.bakureserve.model.RecommendationSource;
import com.bakureserve.model.Restaurant;
import com.bakureserve.repository.RestaurantDirectory;
import com.bakureserve.service.concierge.BookingIntentDetector;
import com.bakureserve.service.concierge.HybridConciergeDispatcher;
import com.bakureserve.service.concierge.PromptCatalog;
import com.bakureserve.service.concierge.ResponseComposer;
import com.bakureserve.service.session.ConciergeSession;
import com.bakureserve.service.session.ConciergeSessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * 컨시어지 대화 흐름
 * Flow: 사용자 텍스트 → 예약 의도 (감지 시 바로 응답) → 하이브리드 디스패치 → 응답 문구 → 대화 기록
 */
@Service
public class ConciergeService {

    private static final Logger logger = LoggerFactory.getLogger(ConciergeService.class);

    private final ConciergeSessionRegistry sessionRegistry;
    private final RestaurantDirectory restaurantDirectory;
    private final BookingIntentDetector bookingIntentDetector;
    private final HybridConciergeDispatcher dispatcher;
    private final PromptCatalog promptCatalog;
    private final ResponseComposer responseComposer;
    private final Executor conciergeExecutor;
    private final int defaultLimit;

    public ConciergeService(ConciergeSessionRegistry sessionRegistry,
                            RestaurantDirectory restaurantDirectory,
                            BookingIntentDetector bookingIntentDetector,
                            HybridConciergeDispatcher dispatcher,
                            PromptCatalog promptCatalog,
                            ResponseComposer responseComposer,
                            @Qualifier("conciergeExecutor") Executor conciergeExecutor,
                            ConciergeProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.restaurantDirectory = restaurantDirectory;
        this.bookingIntentDetector = bookingIntentDetector;
        this.dispatcher = dispatcher;
        this.promptCatalog = promptCatalog;
        this.responseComposer = responseComposer;
        this.conciergeExecutor = conciergeExecutor;
        this.defaultLimit = properties.getDefaultLimit();
    }

    public ConciergeSessionResponse openSession() {
        ConciergeSession session = sessionRegistry.create();
        session.append(ConciergeMessage.assistant(responseComposer.introMessage(), null, null));
        logger.info("[ConciergeService] session opened - sessionId: {}, mode: {}", session.getId(), dispatcher.getMode());
        return toSessionResponse(session);
    }

    public ConciergeSessionResponse getSession(String sessionId) {
        return toSessionResponse(sessionRegistry.require(sessionId));
    }

    public void closeSession(String sessionId) {
        sessionRegistry.remove(sessionId);
        logger.info("[ConciergeService] session closed - sessionId: {}", sessionId);
    }

    /**
     * 자유 텍스트 처리
     * 예약 발화는 즉시 응답, 나머지는 하이브리드 디스패처를 거쳐 비동기로 완료될 수 있음
     */
    public CompletableFuture<ConciergeReplyResponse> submitText(String sessionId, String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Concierge text must not be blank");
        }
        String trimmed = text.trim();
        ConciergeSession session = sessionRegistry.require(sessionId);
        List<Restaurant> snapshot = restaurantDirectory.findAll();

        Optional<BookingIntent> booking = bookingIntentDetector.detectBookingIntent(trimmed, snapshot);
        if (booking.isPresent()) {
            return CompletableFuture.completedFuture(respondBooking(session, trimmed, booking.get()));
        }

        long token = session.beginRequest(ConciergeMessage.user(trimmed));
        logger.info("[ConciergeService] submitText - sessionId: {}, token: {}", session.getId(), token);
        return dispatch(() -> dispatcher.dispatchDiscovery(trimmed, snapshot, defaultLimit))
                .thenApply(result -> completeDiscovery(session, token, result));
    }

    /**
     * 프롬프트 칩 선택 처리
     */
    public CompletableFuture<ConciergeReplyResponse> submitPrompt(String sessionId, String promptId) {
        ConciergeSession session = sessionRegistry.require(sessionId);
        ConciergePrompt prompt = promptCatalog.findPromptById(promptId)
                .orElseThrow(() -> ConciergeNotFoundException.prompt(promptId));
        List<Restaurant> snapshot = restaurantDirectory.findAll();

        long token = session.beginRequest(ConciergeMessage.user(prompt.getTitle()));
        logger.info("[ConciergeService] submitPrompt - sessionId: {}, prompt: {}, token: {}",
                session.getId(), prompt.getId(), token);
        return dispatch(() -> dispatcher.dispatchPrompt(prompt, prompt.getTitle(), snapshot, defaultLimit))
                .thenApply(result -> completePrompt(session, token, prompt, result));
    }

    private ConciergeReplyResponse respondBooking(ConciergeSession session, String text, BookingIntent intent) {
        long token = session.beginRequest(ConciergeMessage.user(text));
        List<Restaurant> suggestions = intent.isResolved() ? List.of(intent.getRestaurant()) : null;
        ConciergeMessage reply = ConciergeMessage.assistant(responseComposer.composeBooking(intent), suggestions, intent);
        boolean appended = session.completeRequest(token, reply);
        return ConciergeReplyResponse.builder()
                .sessionId(session.getId())
                .reply(appended ? reply : null)
                .discarded(!appended)
                .booking(true)
                .source(RecommendationSource.LOCAL)
                .build();
    }

    /**
     * 탐색 결과를 응답 문구로 변환 (원격 문구 우선)
     */
    private ConciergeReplyResponse completeDiscovery(ConciergeSession session, long token, RecommendationResult result) {
        String text;
        List<Restaurant> suggestions = result.getItems();
        if (result.getSource() == RecommendationSource.REMOTE) {
            text = hasText(result.getMessage())
                    ? result.getMessage()
                    : responseComposer.composeRecommendation(null, suggestions, null, false);
        } else if (result.isNeedsMoreInfo()) {
            text = responseComposer.composeNeedsMoreInfo();
            suggestions = null;
        } else {
            text = responseComposer.composeRecommendation(null, suggestions, result.getSummary(), result.isRelaxed());
        }
        return complete(session, token, ConciergeMessage.assistant(text, suggestions, null), result);
    }

    private ConciergeReplyResponse completePrompt(ConciergeSession session, long token,
                                                  ConciergePrompt prompt, RecommendationResult result) {
        String text = result.getSource() == RecommendationSource.REMOTE && hasText(result.getMessage())
                ? result.getMessage()
                : responseComposer.composeRecommendation(prompt, result.getItems(), null, false);
        return complete(session, token, ConciergeMessage.assistant(text, result.getItems(), null), result);
    }

    /**
     * 토큰이 최신일 때만 대화 기록에 추가
     */
    private ConciergeReplyResponse complete(ConciergeSession session, long token,
                                            ConciergeMessage reply, RecommendationResult result) {
        boolean appended = session.completeRequest(token, reply);
        if (!appended) {
            logger.info("[ConciergeService] discarding stale reply - sessionId: {}, token: {}", session.getId(), token);
        }
        return ConciergeReplyResponse.builder()
                .sessionId(session.getId())
                .reply(appended ? reply : null)
                .discarded(!appended)
                .needsMoreInfo(result.isNeedsMoreInfo())
                .relaxed(result.isRelaxed())
                .source(result.getSource())
                .build();
    }

    // 원격 호출이 있는 AI 모드만 별도 스레드에서 실행
    private CompletableFuture<RecommendationResult> dispatch(Supplier<RecommendationResult> work) {
        if (dispatcher.getMode() == ConciergeMode.AI) {
            return CompletableFuture.supplyAsync(work, conciergeExecutor);
        }
        return CompletableFuture.completedFuture(work.get());
    }

    private ConciergeSessionResponse toSessionResponse(ConciergeSession session) {
        return new ConciergeSessionResponse(session.getId(), session.getCreatedAt(), dispatcher.getMode(), session.getMessages());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
