package com.bakureserve.config;

import com.bakureserve.repository.RestaurantDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.Executor;

@Configuration
public class ConciergeConfig {

    /**
     * 원격 랭커용 RestTemplate (연결/읽기 타임아웃 적용)
     */
    @Bean
    public RestTemplate conciergeRestTemplate(RestTemplateBuilder builder, ConciergeProperties properties) {
        ConciergeProperties.Remote remote = properties.getRemote();
        return builder
                .setConnectTimeout(remote.getConnectTimeout())
                .setReadTimeout(remote.getReadTimeout())
                .build();
    }

    /**
     * 시드 JSON에서 식당 디렉터리 로드
     */
    @Bean
    public RestaurantDirectory restaurantDirectory(ResourceLoader resourceLoader,
                                                  ObjectMapper objectMapper,
                                                  ConciergeProperties properties) {
        return RestaurantDirectory.load(resourceLoader, objectMapper, properties.getDirectory().getSeed());
    }

    // 원격 랭킹 호출 전용 (로컬 매칭은 호출 스레드에서 실행)
    @Bean("conciergeExecutor")
    public Executor conciergeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("Concierge-");
        executor.initialize();
        return executor;
    }
}
