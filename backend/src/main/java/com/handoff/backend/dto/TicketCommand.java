package com.handoff.backend.dto;

import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import com.handoff.backend.model.Source;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the find-or-create and create ticket operations. Missing category or reason is inferred from the
 * description.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketCommand {

    @NotBlank
    @Size(max = 4000)
    private String description;

    private Category category;

    private EscalationReason escalationReason;

    @Pattern(regexp = "^\\+[1-9]\\d{1,14}$", message = "must be an E.164 phone number, e.g. +15551234567")
    private String callerNumber;

    @Pattern(regexp = "^[A-Za-z0-9_-]{6,64}$", message = "must be 6-64 characters of letters, digits, '_' or '-'")
    private String oaKey;

    private Source source;
}
