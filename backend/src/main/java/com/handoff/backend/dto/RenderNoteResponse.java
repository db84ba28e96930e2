package com.handoff.backend.dto;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderNoteResponse {

    private String note;
    private Category category;
    private EscalationReason escalationReason;
    private String confidence;
    private int charCount;
    private int lineCount;
}
