package com.handoff.backend.service;

import com.handoff.backend.dto.HandoffRequest;
import com.handoff.backend.dto.HandoffResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Entry point for inbound handoffs: idempotency first, then the orchestrator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HandoffIngestService {

    private final IdempotencyGuard idempotencyGuard;
    private final TicketOrchestrator ticketOrchestrator;
    private final MetricsService metricsService;

    public IdempotentResponse<HandoffResponse> ingest(String idempotencyKey, HandoffRequest request) {
        IdempotentResponse<HandoffResponse> response = idempotencyGuard.execute(idempotencyKey, request,
                HttpStatus.OK.value(), HandoffResponse.class, () -> ticketOrchestrator.handoff(request));
        if (response.replayed()) {
            metricsService.incrementIdempotentReplays();
        }
        return response;
    }
}
