package com.bakureserve.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 대화 기록 한 건 (추가된 후에는 변경되지 않음)
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConciergeMessage {
    String id;
    MessageRole role;
    String text;
    List<Restaurant> suggestions;
    BookingIntent bookingCandidate;
    Instant createdAt;

    public static ConciergeMessage user(String text) {
        return ConciergeMessage.builder()
                .id("user-" + UUID.randomUUID())
                .role(MessageRole.USER)
                .text(text)
                .createdAt(Instant.now())
                .build();
    }

    public static ConciergeMessage assistant(String text, List<Restaurant> suggestions, BookingIntent bookingCandidate) {
        return ConciergeMessage.builder()
                .id("assistant-" + UUID.randomUUID())
                .role(MessageRole.ASSISTANT)
                .text(text)
                .suggestions(suggestions == null ? null : List.copyOf(suggestions))
                .bookingCandidate(bookingCandidate)
                .createdAt(Instant.now())
                .build();
    }
}
