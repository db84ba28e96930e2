package com.handoff.backend.dto;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderNoteRequest {

    @NotBlank
    private String summary;

    private Category category;

    private EscalationReason escalationReason;

    private String confidence;

    /** When true the summary is shortened to fit instead of rejected. */
    private boolean truncate;
}
