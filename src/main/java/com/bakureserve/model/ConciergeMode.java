package com.bakureserve.model;

import java.util.Locale;
import java.util.Set;

public enum ConciergeMode {
    LOCAL,
    AI;

    private static final Set<String> REMOTE_ALIASES = Set.of("ai", "remote", "backend", "server");

    /**
     * 알 수 없는 값이나 빈 값은 LOCAL
     */
    public static ConciergeMode fromValue(String value) {
        if (value == null) {
            return LOCAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return REMOTE_ALIASES.contains(normalized) ? AI : LOCAL;
    }
}
