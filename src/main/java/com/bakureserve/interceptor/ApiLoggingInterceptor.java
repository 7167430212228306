package com.bakureserve.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.WebUtils;

import java.nio.charset.StandardCharsets;

/**
 * API 요청/응답 로깅 Interceptor
 */
@Component
public class ApiLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(ApiLoggingInterceptor.class);

    private static final String START_TIME_ATTRIBUTE = "startTime";
    private static final int MAX_BODY_LOG_LENGTH = 300;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // 요청 시작 시간 기록 (비동기 요청은 preHandle이 두 번 호출되므로 최초 값 유지)
        if (request.getAttribute(START_TIME_ATTRIBUTE) == null) {
            request.setAttribute(START_TIME_ATTRIBUTE, System.currentTimeMillis());
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        // 요청 시작 시간 가져오기
        Long startTime = (Long) request.getAttribute(START_TIME_ATTRIBUTE);
        if (startTime == null) {
            return;
        }
        long responseTimeMs = System.currentTimeMillis() - startTime;

        if (ex != null) {
            logger.warn("[API] {} {} -> {} ({} ms) failed: {}", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), responseTimeMs, ex.getMessage());
            return;
        }
        logger.info("[API] {} {} -> {} ({} ms) body: {}", request.getMethod(), request.getRequestURI(),
                response.getStatus(), responseTimeMs, getRequestBody(request));
    }

    /**
     * 요청 본문 읽기 (최대 300자)
     */
    private String getRequestBody(HttpServletRequest request) {
        ContentCachingRequestWrapper wrapper = WebUtils.getNativeRequest(request, ContentCachingRequestWrapper.class);
        if (wrapper == null) {
            // ContentCachingRequestWrapper가 아닌 경우 이미 읽은 본문은 다시 읽을 수 없으므로 null 반환
            return null;
        }
        byte[] content = wrapper.getContentAsByteArray();
        if (content.length == 0) {
            return null;
        }
        String body = new String(content, StandardCharsets.UTF_8);
        return body.length() > MAX_BODY_LOG_LENGTH ? body.substring(0, MAX_BODY_LOG_LENGTH) + "..." : body;
    }
}
