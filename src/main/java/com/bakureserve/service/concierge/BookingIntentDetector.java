package com.bakureserve.service.concierge;

import com.bakureserve.config.ConciergeProperties;
import com.bakureserve.model.BookingIntent;
import com.bakureserve.model.RelativeDate;
import com.bakureserve.model.Restaurant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "book a table at X" 형태의 예약 발화 감지
 * 식당은 이름 유사도로 찾음
 */
@Component
public class BookingIntentDetector {

    private static final Logger logger = LoggerFactory.getLogger(BookingIntentDetector.class);

    private static final Pattern BOOKING_KEYWORDS = Pattern.compile(
            "\\b(book(s|ed|ing)?|reserv(e|ed|es|ing|ation|ations)|tables?|res)\\b");
    private static final Pattern TIME = Pattern.compile("\\b(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?\\b");

    static final int CONTAINS_QUERY_SCORE = 6;
    static final int CONTAINED_IN_QUERY_SCORE = 5;

    private final int minNameConfidence;

    public BookingIntentDetector(ConciergeProperties properties) {
        this.minNameConfidence = Math.max(1, properties.getBooking().getMinNameConfidence());
    }

    /**
     * 예약 키워드가 없으면 empty
     * 의도는 있지만 식당이 null이면 호출 측에서 어느 식당인지 되물어야 함
     */
    public Optional<BookingIntent> detectBookingIntent(String text, List<Restaurant> restaurants) {
        if (text == null) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (!BOOKING_KEYWORDS.matcher(lower).find()) {
            return Optional.empty();
        }

        Integer partySize = null;
        int partyStart = -1;
        int partyEnd = -1;
        Matcher party = DiscoveryFilterExtractor.GROUP_SIZE.matcher(lower);
        if (party.find()) {
            partySize = Integer.parseInt(party.group(2));
            partyStart = party.start(2);
            partyEnd = party.end(2);
        }

        String time = parseTime(lower, partyStart, partyEnd);
        RelativeDate date = parseDate(lower);

        Restaurant best = null;
        int bestScore = 0;
        if (restaurants != null) {
            for (Restaurant restaurant : restaurants) {
                int score = fuzzyScoreName(restaurant.getName(), text);
                // 동점이면 먼저 본 식당 유지
                if (score >= minNameConfidence && score > bestScore) {
                    best = restaurant;
                    bestScore = score;
                }
            }
        }

        logger.info("[BookingIntentDetector] booking intent - restaurant: {}, score: {}, partySize: {}, time: {}, date: {}",
                best != null ? best.getName() : null, bestScore, partySize, time, date);
        return Optional.of(BookingIntent.builder()
                .restaurant(best)
                .partySize(partySize)
                .time(time)
                .date(date)
                .nameConfidence(bestScore)
                .build());
    }

    /**
     * 이름 유사도 점수
     * 이름이 질의 전체를 포함하면 6, 질의가 이름 전체를 포함하면 5, 아니면 질의에 단어로 등장하는 이름 토큰당 1점
     */
    int fuzzyScoreName(String name, String query) {
        if (name == null || query == null) {
            return 0;
        }
        String normName = normalizeName(name);
        String normQuery = normalizeName(query);
        if (normName.isEmpty() || normQuery.isEmpty()) {
            return 0;
        }
        if (normName.contains(normQuery)) {
            return CONTAINS_QUERY_SCORE;
        }
        if (normQuery.contains(normName)) {
            return CONTAINED_IN_QUERY_SCORE;
        }
        Set<String> queryWords = new HashSet<>(Arrays.asList(normQuery.split(" ")));
        int score = 0;
        for (String part : new LinkedHashSet<>(Arrays.asList(normName.split(" ")))) {
            if (queryWords.contains(part)) {
                score++;
            }
        }
        return score;
    }

    /**
     * 시간 추출 (HH:MM)
     * am/pm이나 분이 붙은 표현 ("8pm", "19:30")을 우선하고, 인원수 숫자는 건너뜀
     */
    String parseTime(String lower, int partyStart, int partyEnd) {
        Matcher matcher = TIME.matcher(lower);
        MatchResult fallback = null;
        while (matcher.find()) {
            if (partyStart >= 0 && matcher.start(1) >= partyStart && matcher.start(1) < partyEnd) {
                continue;
            }
            if (matcher.group(2) != null || matcher.group(3) != null) {
                return formatTime(matcher.group(1), matcher.group(2), matcher.group(3));
            }
            if (fallback == null) {
                fallback = matcher.toMatchResult();
            }
        }
        if (fallback == null) {
            return null;
        }
        return formatTime(fallback.group(1), fallback.group(2), fallback.group(3));
    }

    private static String formatTime(String hourText, String minuteText, String meridiem) {
        int hours = Integer.parseInt(hourText);
        int minutes = minuteText != null ? Integer.parseInt(minuteText) : 0;
        if ("pm".equals(meridiem) && hours < 12) {
            hours += 12;
        }
        if ("am".equals(meridiem) && hours == 12) {
            hours = 0;
        }
        hours = Math.max(0, Math.min(23, hours));
        minutes = Math.max(0, Math.min(59, minutes));
        return String.format("%02d:%02d", hours, minutes);
    }

    /**
     * tonight/today -> today, tomorrow -> tomorrow
     */
    private static RelativeDate parseDate(String lower) {
        if (lower.contains("tonight") || lower.contains("today")) {
            return RelativeDate.TODAY;
        }
        if (lower.contains("tomorrow")) {
            return RelativeDate.TOMORROW;
        }
        return null;
    }

    static String normalizeName(String value) {
        return value.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
