package com.bakureserve.model;

import lombok.Builder;
import lombok.Value;

/**
 * 감지된 예약 의도
 * 이름이 충분히 매칭되지 않으면 {@code restaurant}는 null
 */
@Value
@Builder
public class BookingIntent {
    Restaurant restaurant;
    Integer partySize;
    String time; // HH:MM, 24시간제
    RelativeDate date;
    int nameConfidence;

    public boolean isResolved() {
        return restaurant != null;
    }
}
