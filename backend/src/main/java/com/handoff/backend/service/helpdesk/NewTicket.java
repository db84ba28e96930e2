package com.handoff.backend.service.helpdesk;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import com.handoff.backend.model.Source;
import lombok.Builder;

import java.util.Map;

@Builder
public record NewTicket(
        String description,
        Category category,
        EscalationReason escalationReason,
        String callerNumber,
        Source source,
        Map<String, Object> metadata
) {
}
