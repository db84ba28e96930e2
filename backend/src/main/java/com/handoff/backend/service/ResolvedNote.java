package com.handoff.backend.service;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import lombok.Builder;

/**
 * Classification and canonical note derived from an inbound handoff.
 */
@Builder
public record ResolvedNote(Category category, EscalationReason reason, String confidence, String summary,
                           String note) {
}
