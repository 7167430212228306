package com.bakureserve.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

import java.io.IOException;

/**
 * 요청 본문을 캐싱하기 위한 필터
 * Interceptor에서 요청 본문을 읽을 수 있도록 함
 */
@Component
public class RequestWrapperFilter extends OncePerRequestFilter {

    /**
     * /api 이외의 경로는 래핑하지 않음
     */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        // 이미 래핑된 요청은 그대로 통과 (비동기 재디스패치)
        if (request instanceof ContentCachingRequestWrapper) {
            filterChain.doFilter(request, response);
            return;
        }

        // 요청 본문을 캐싱할 수 있도록 래핑
        filterChain.doFilter(new ContentCachingRequestWrapper(request), response);
    }
}
