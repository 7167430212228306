package com.bakureserve.service.concierge;

import com.bakureserve.model.BookingIntent;
import com.bakureserve.model.ConciergePrompt;
import com.bakureserve.model.Restaurant;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 어시스턴트 응답 문구 생성
 */
@Component
public class ResponseComposer {

    static final String INTRO = "Tell me the mood, cuisine, or size of your group. "
            + "I will shortlist great tables you can book right now.";
    static final String NO_FIT = "I could not find a perfect fit yet, but here are a few versatile picks to start with.";
    static final String NEEDS_MORE_INFO = "Tell me a vibe, cuisine, budget, or neighborhood and I'll shortlist options.";
    static final String ASK_FOR_RESTAURANT = "Tell me which restaurant to book and I will open the booking screen.";

    public String introMessage() {
        return INTRO;
    }

    /**
     * @param prompt  선택한 프롬프트 (자유 텍스트 탐색이면 null)
     * @param summary 필터 요약 (필터 기반 결과가 아니면 null)
     */
    public String composeRecommendation(ConciergePrompt prompt, List<Restaurant> suggestions,
                                        String summary, boolean relaxed) {
        if (prompt != null && prompt.hasResponseHint()) {
            return prompt.getResponseHint();
        }
        boolean hasSuggestions = suggestions != null && !suggestions.isEmpty();
        if (summary != null && !summary.isBlank() && hasSuggestions) {
            return String.format("%s for %s.", relaxed ? "Closest matches" : "Here are spots", summary);
        }
        if (!hasSuggestions) {
            return NO_FIT;
        }
        String names = suggestions.stream()
                .limit(2)
                .map(Restaurant::getName)
                .collect(Collectors.joining(", "));
        return String.format("Here are spots that match. Start with %s.", names);
    }

    public String composeNeedsMoreInfo() {
        return NEEDS_MORE_INFO;
    }

    /**
     * 예약 안내 문구 (식당이 없으면 되묻기)
     */
    public String composeBooking(BookingIntent intent) {
        if (intent == null || !intent.isResolved()) {
            return ASK_FOR_RESTAURANT;
        }
        StringBuilder text = new StringBuilder("I can start a booking at ").append(intent.getRestaurant().getName());
        if (intent.getPartySize() != null) {
            text.append(" for ").append(intent.getPartySize());
        }
        if (intent.getTime() != null) {
            text.append(" at ").append(intent.getTime());
        }
        return text.append('.').toString();
    }
}
