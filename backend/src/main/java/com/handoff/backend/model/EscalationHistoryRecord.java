package com.handoff.backend.model;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Escalation as reported by the helpdesk history endpoint. A missing close time means it is still open.
 */
@Builder
public record EscalationHistoryRecord(
        String escalationId,
        String ticketId,
        String billId,
        Instant entryTime,
        Instant closeTime,
        String summary
) {

    public boolean isClosed() {
        return closeTime != null;
    }

    /**
     * Hours from entry to close. Empty while open, and empty when the close time precedes the entry time.
     */
    public Optional<Double> resolutionHours() {
        if (entryTime == null || closeTime == null || closeTime.isBefore(entryTime)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(entryTime, closeTime).toMillis() / 3_600_000.0);
    }
}
