package com.handoff.backend.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Ticket as reported by the helpdesk history endpoint. Read-only.
 */
@Builder
public record TicketHistoryRecord(
        String ticketId,
        Instant entryTime,
        String service,
        String category,
        String billId,
        String description
) {
}
