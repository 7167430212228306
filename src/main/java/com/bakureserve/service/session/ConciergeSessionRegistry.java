package com.bakureserve.service.session;

import com.bakureserve.config.ConciergeProperties;
import com.bakureserve.exception.ConciergeNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 인메모리 세션 저장소 (재시작 시 유실)
 * 마지막 접근 후 TTL이 지난 세션은 만료, 최대 개수를 넘으면 오래된 세션부터 제거
 */
@Component
public class ConciergeSessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConciergeSessionRegistry.class);

    private final Map<String, ConciergeSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;
    private final int maxSessions;

    @Autowired
    public ConciergeSessionRegistry(ConciergeProperties properties) {
        this(properties, Clock.systemUTC());
    }

    ConciergeSessionRegistry(ConciergeProperties properties, Clock clock) {
        this.clock = clock;
        this.ttl = properties.getSession().getTtl();
        this.maxSessions = Math.max(1, properties.getSession().getMaxSessions());
    }

    public ConciergeSession create() {
        Instant now = clock.instant();
        purgeExpired(now);
        evictOverflow();

        ConciergeSession session = new ConciergeSession(UUID.randomUUID().toString(), now);
        sessions.put(session.getId(), session);
        return session;
    }

    /**
     * 세션 조회, 만료되었거나 없으면 404
     */
    public ConciergeSession require(String sessionId) {
        ConciergeSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null) {
            throw ConciergeNotFoundException.session(sessionId);
        }

        Instant now = clock.instant();
        if (session.isExpired(now, ttl)) {
            // 만료되었으면 제거
            sessions.remove(sessionId);
            throw ConciergeNotFoundException.session(sessionId);
        }
        session.touch(now);
        return session;
    }

    public void remove(String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw ConciergeNotFoundException.session(sessionId);
        }
    }

    public int size() {
        return sessions.size();
    }

    /**
     * 만료 세션 일괄 제거
     */
    private void purgeExpired(Instant now) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.isExpired(now, ttl));
        int purged = before - sessions.size();
        if (purged > 0) {
            logger.info("[ConciergeSessionRegistry] purged {} expired sessions", purged);
        }
    }

    /**
     * 최대 개수 초과 시 가장 오래 접근되지 않은 세션부터 제거 (90%까지)
     */
    private void evictOverflow() {
        if (sessions.size() < maxSessions) {
            return;
        }
        int target = Math.max(0, maxSessions - Math.max(1, maxSessions / 10));
        List<ConciergeSession> oldest = sessions.values().stream()
                .sorted(Comparator.comparing(ConciergeSession::getLastAccessedAt))
                .limit(Math.max(0, sessions.size() - target))
                .collect(Collectors.toList());
        oldest.forEach(session -> sessions.remove(session.getId()));
        logger.warn("[ConciergeSessionRegistry] session capacity {} reached, evicted {} idle sessions",
                maxSessions, oldest.size());
    }
}
