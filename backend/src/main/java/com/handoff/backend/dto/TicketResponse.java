package com.handoff.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TicketResponse {

    private String ticketId;
    private String ticketUrl;
    private Boolean created;
    private Category category;
    private EscalationReason escalationReason;
}
