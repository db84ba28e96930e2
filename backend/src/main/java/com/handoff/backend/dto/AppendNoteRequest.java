package com.handoff.backend.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppendNoteRequest {

    @NotBlank
    private String ticketId;

    @NotBlank
    private String note;

    private String author;
}
