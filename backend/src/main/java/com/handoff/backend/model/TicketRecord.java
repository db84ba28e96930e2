package com.handoff.backend.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Ticket reference remembered for deduplication. Never mutated after creation.
 */
@Builder
public record TicketRecord(
        String ticketId,
        String ticketUrl,
        Instant createdAt,
        String correlationKey,
        String callerNumber,
        Category category
) {
}
