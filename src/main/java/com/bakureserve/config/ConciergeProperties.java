package com.bakureserve.config;

import com.bakureserve.model.ConciergeMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 컨시어지 설정 ({@code concierge.*})
 * 디스패치 모드는 기동 시 한 번만 읽어서 디스패처에 주입
 */
@Data
@ConfigurationProperties(prefix = "concierge")
public class ConciergeProperties {

    /** local | ai (별칭: remote, backend, server) */
    private String mode = "local";

    /** 응답당 추천 개수 */
    private int defaultLimit = 4;

    /** 필터 신호 없이 이보다 짧은 입력은 추가 정보 요청 */
    private int minTextLength = 6;

    private Remote remote = new Remote();

    private Booking booking = new Booking();

    private Directory directory = new Directory();

    private Session session = new Session();

    public ConciergeMode resolveMode() {
        return ConciergeMode.fromValue(mode);
    }

    @Data
    public static class Remote {
        private String baseUrl = "http://localhost:8000";
        private String path = "/concierge/recommendations";
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(8);
    }

    @Data
    public static class Booking {
        /** 식당 매칭으로 인정하는 최소 이름 유사도 점수 */
        private int minNameConfidence = 1;
    }

    @Data
    public static class Session {
        /** 마지막 접근 후 이 시간이 지나면 세션 만료 */
        private Duration ttl = Duration.ofMinutes(30);
        /** 동시에 유지하는 최대 세션 수 */
        private int maxSessions = 10000;
    }

    @Data
    public static class Directory {
        private String seed = "classpath:data/restaurants.json";
    }
}
