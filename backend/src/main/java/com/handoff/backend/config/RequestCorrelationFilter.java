package com.handoff.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts request and correlation ids into the MDC. Runs ahead of the security chain so auth failures carry them too.
 * <p>
 * Without an explicit {@code X-Correlation-Id}, an agent retry is correlated by its {@code Idempotency-Key}, so every
 * attempt of one handoff shares a correlation id in the logs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    static final String MDC_REQUEST_ID = "requestId";
    static final String MDC_CORRELATION_ID = "correlationId";
    static final String MDC_IDEMPOTENCY_KEY = "idempotencyKey";
    private static final int MAX_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String idempotencyKey = clean(request.getHeader(IDEMPOTENCY_KEY_HEADER));
        String requestId = orRandom(clean(request.getHeader(REQUEST_ID_HEADER)));
        String correlationId = clean(request.getHeader(CORRELATION_ID_HEADER));
        if (correlationId == null) {
            correlationId = idempotencyKey != null ? "idem-" + idempotencyKey : requestId;
        }
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_CORRELATION_ID, correlationId);
        if (idempotencyKey != null) {
            MDC.put(MDC_IDEMPOTENCY_KEY, idempotencyKey);
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_CORRELATION_ID);
            MDC.remove(MDC_IDEMPOTENCY_KEY);
        }
    }

    /** Header values end up in log lines; keep them short and printable. */
    private static String clean(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String printable = value.trim().replaceAll("[^\\x21-\\x7E]", "");
        if (printable.isEmpty()) {
            return null;
        }
        return printable.length() > MAX_ID_LENGTH ? printable.substring(0, MAX_ID_LENGTH) : printable;
    }

    private static String orRandom(String value) {
        return value != null ? value : UUID.randomUUID().toString();
    }
}
