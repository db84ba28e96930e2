package com.handoff.backend.model;

import lombok.Builder;

import java.time.Instant;

@Builder(toBuilder = true)
public record IdempotencyRecord(
        String idempotencyKey,
        String requestHash,
        Status status,
        Object response,
        int statusCode,
        String correlationId,
        Instant recordedAt
) {

    public enum Status {
        IN_PROGRESS,
        COMPLETED
    }
}
