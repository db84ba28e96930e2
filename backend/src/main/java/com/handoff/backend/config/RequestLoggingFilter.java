package com.handoff.backend.config;

import com.handoff.backend.controller.IngestController;
import com.handoff.backend.security.CallerPrincipal;
import com.handoff.backend.security.HandoffAuthenticationFilter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;

/**
 * One access line per request: caller mode, status, replay flag and latency. Health checks log at debug.
 */
@Component
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            String caller = callerMode(request);
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            String replayed = response.getHeader(IngestController.REPLAY_HEADER);
            if (request.getRequestURI().startsWith("/actuator/health")) {
                log.debug("HTTP {} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
                        response.getStatus(), durationMs);
            } else {
                log.info("HTTP {} {} caller={} -> {}{} ({} ms)", request.getMethod(), request.getRequestURI(), caller,
                        response.getStatus(), "true".equals(replayed) ? " replayed" : "", durationMs);
            }
        }
    }

    /** The security context is already cleared here, so the auth filter leaves the principal on the request. */
    private static String callerMode(HttpServletRequest request) {
        if (request.getAttribute(HandoffAuthenticationFilter.PRINCIPAL_ATTRIBUTE) instanceof CallerPrincipal principal) {
            return principal.getMode().name().toLowerCase(Locale.ROOT);
        }
        return "anonymous";
    }
}
