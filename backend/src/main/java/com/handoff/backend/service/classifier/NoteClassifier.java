package com.handoff.backend.service.classifier;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;

/**
 * Infers classification from free text. Implementations must be pure: same text, same answer.
 */
public interface NoteClassifier {

    Category inferCategory(String text);

    EscalationReason inferReason(String text);
}
