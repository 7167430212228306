package com.bakureserve.service.session;

import com.bakureserve.model.ConciergeMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 대화 세션 하나
 * 대화 기록은 append-only, 질의마다 요청 토큰을 발급하고 최신 토큰을 가진 응답만 기록에 추가
 */
public class ConciergeSession {

    private final String id;
    private final Instant createdAt;
    private final List<ConciergeMessage> transcript = new ArrayList<>();
    private long latestToken;
    private volatile Instant lastAccessedAt;

    public ConciergeSession(String id) {
        this(id, Instant.now());
    }

    public ConciergeSession(String id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    /**
     * 마지막 접근 시각 갱신 (만료 판정 기준)
     */
    public void touch(Instant now) {
        this.lastAccessedAt = now;
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return now.isAfter(lastAccessedAt.plus(ttl));
    }

    public synchronized void append(ConciergeMessage message) {
        transcript.add(message);
    }

    /**
     * 사용자 메시지를 추가하고 새 요청 토큰 발급 (대기 중인 이전 요청은 무효화)
     */
    public synchronized long beginRequest(ConciergeMessage userMessage) {
        transcript.add(userMessage);
        return ++latestToken;
    }

    /**
     * @return 그 사이 더 새로운 요청이 발급되었으면 false (응답은 버려짐)
     */
    public synchronized boolean completeRequest(long token, ConciergeMessage reply) {
        if (token != latestToken) {
            return false;
        }
        transcript.add(reply);
        return true;
    }

    public synchronized List<ConciergeMessage> getMessages() {
        return List.copyOf(transcript);
    }
}
