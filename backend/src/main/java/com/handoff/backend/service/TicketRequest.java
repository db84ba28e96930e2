package com.handoff.backend.service;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import com.handoff.backend.model.Source;
import lombok.Builder;

import java.util.Map;

/**
 * Everything needed to find or create a ticket. Category and reason are already resolved.
 */
@Builder
public record TicketRequest(
        String description,
        Category category,
        EscalationReason escalationReason,
        String callerNumber,
        String correlationKey,
        Source source,
        Map<String, Object> metadata
) {
}
