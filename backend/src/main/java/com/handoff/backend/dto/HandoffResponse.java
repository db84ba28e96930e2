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
public class HandoffResponse {

    private String status;
    private boolean created;
    private String ticketId;
    private String ticketUrl;
    private Category category;
    private EscalationReason escalationReason;
    private String confidence;
    private Echo echo;

    public record Echo(String oaKey, String callerNumber) {
    }
}
