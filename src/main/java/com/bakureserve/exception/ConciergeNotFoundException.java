package com.bakureserve.exception;

/**
 * 세션/프롬프트/식당을 찾을 수 없음 (404)
 */
public class ConciergeNotFoundException extends RuntimeException {

    public ConciergeNotFoundException(String message) {
        super(message);
    }

    public static ConciergeNotFoundException session(String sessionId) {
        return new ConciergeNotFoundException("Concierge session not found: " + sessionId);
    }

    public static ConciergeNotFoundException prompt(String promptId) {
        return new ConciergeNotFoundException("Concierge prompt not found: " + promptId);
    }
}
