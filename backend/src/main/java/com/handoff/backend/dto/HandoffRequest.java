package com.handoff.backend.dto;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import com.handoff.backend.model.Source;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound handoff. {@code note} may be a rendered 4-line note or free text; at least one of note and summary
 * is required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HandoffRequest {

    @Size(max = 4000)
    private String note;

    @Size(max = 4000)
    private String summary;

    private Category category;

    private EscalationReason escalationReason;

    @Pattern(regexp = "^(0(\\.\\d+)?|1(\\.0+)?)$", message = "must be a decimal string from 0.0 to 1.0")
    private String confidence;

    @Pattern(regexp = "^\\+[1-9]\\d{1,14}$", message = "must be an E.164 phone number, e.g. +15551234567")
    private String callerNumber;

    @Pattern(regexp = "^[A-Za-z0-9_-]{6,64}$", message = "must be 6-64 characters of letters, digits, '_' or '-'")
    private String oaKey;

    private Source source;
}
