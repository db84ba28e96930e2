package com.handoff.backend.config;

import com.handoff.backend.exception.RateLimitExceededException;
import com.handoff.backend.security.CallerPrincipal;
import com.handoff.backend.service.MetricsService;
import com.handoff.backend.service.RateLimitService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies the per-identity rate limit after authentication and before any idempotency or dedup work.
 * Rejections are rendered by the exception handler as 429 with {@code Retry-After}.
 */
@Slf4j
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimitService rateLimitService;
    private final MetricsService metricsService;

    public RateLimitInterceptor(RateLimitService rateLimitService, MetricsService metricsService) {
        this.rateLimitService = rateLimitService;
        this.metricsService = metricsService;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String identity = resolveKey(request);
        RateLimitService.RateLimitDecision decision = rateLimitService.allowWithRetryAfter(identity);
        if (decision.allowed()) {
            return true;
        }
        metricsService.incrementRateLimitRejections();
        log.warn("Rate limit exceeded for {} on {} {}", identity, request.getMethod(), request.getRequestURI());
        throw new RateLimitExceededException("Rate limit exceeded", decision.retryAfterSeconds());
    }

    private String resolveKey(HttpServletRequest request) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof CallerPrincipal principal) {
            return principal.rateLimitIdentity();
        }
        return "ip:" + request.getRemoteAddr();
    }
}
