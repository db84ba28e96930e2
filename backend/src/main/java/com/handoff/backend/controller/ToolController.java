package com.handoff.backend.controller;

import com.handoff.backend.dto.AppendNoteRequest;
import com.handoff.backend.dto.AppendNoteResponse;
import com.handoff.backend.dto.HandoffRequest;
import com.handoff.backend.dto.HandoffResponse;
import com.handoff.backend.dto.RenderNoteRequest;
import com.handoff.backend.dto.RenderNoteResponse;
import com.handoff.backend.dto.TicketCommand;
import com.handoff.backend.dto.TicketResponse;
import com.handoff.backend.model.Category;
import com.handoff.backend.model.EscalationReason;
import com.handoff.backend.model.NoteComponents;
import com.handoff.backend.model.Source;
import com.handoff.backend.service.NoteProcessor;
import com.handoff.backend.service.TicketOrchestrator;
import com.handoff.backend.service.TicketRequest;
import com.handoff.backend.service.TicketResolution;
import com.handoff.backend.service.helpdesk.HelpdeskTicket;
import com.handoff.backend.service.helpdesk.NoteAppendResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * The individual handoff operations, exposed one by one for agent tooling.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
@Tag(name = "Tools")
public class ToolController {

    private final NoteProcessor noteProcessor;
    private final TicketOrchestrator ticketOrchestrator;

    @PostMapping("/render-note")
    @Operation(summary = "Render the canonical 4-line note")
    public ResponseEntity<RenderNoteResponse> renderNote(@Valid @RequestBody RenderNoteRequest request) {
        Category category = request.getCategory() != null
                ? request.getCategory()
                : noteProcessor.inferCategory(request.getSummary());
        EscalationReason reason = request.getEscalationReason() != null
                ? request.getEscalationReason()
                : noteProcessor.inferReason(request.getSummary());
        String confidence = request.getConfidence() != null ? request.getConfidence() : NoteProcessor.DEFAULT_CONFIDENCE;
        noteProcessor.validateConfidence(confidence);
        NoteComponents components = NoteComponents.builder()
                .category(category.name())
                .reason(reason.name())
                .summary(request.getSummary())
                .confidence(confidence)
                .build();
        String note = request.isTruncate() ? noteProcessor.renderFitting(components) : noteProcessor.render(components);
        return ResponseEntity.ok(RenderNoteResponse.builder()
                .note(note)
                .category(category)
                .escalationReason(reason)
                .confidence(confidence)
                .charCount(note.length())
                .lineCount(NoteProcessor.LINE_COUNT)
                .build());
    }

    @PostMapping("/find-or-create-ticket")
    @Operation(summary = "Find a recent ticket for this caller or correlation key, or create one")
    public ResponseEntity<TicketResponse> findOrCreateTicket(@Valid @RequestBody TicketCommand command) {
        TicketRequest request = toTicketRequest(command);
        TicketResolution resolution = ticketOrchestrator.findOrCreate(request);
        return ResponseEntity.ok(TicketResponse.builder()
                .ticketId(resolution.ticketId())
                .ticketUrl(resolution.ticketUrl())
                .created(resolution.created())
                .category(request.category())
                .escalationReason(request.escalationReason())
                .build());
    }

    @PostMapping("/create-ticket")
    @Operation(summary = "Create a ticket without deduplication")
    public ResponseEntity<TicketResponse> createTicket(@Valid @RequestBody TicketCommand command) {
        TicketRequest request = toTicketRequest(command);
        HelpdeskTicket ticket = ticketOrchestrator.createTicketDirect(request);
        return ResponseEntity.ok(TicketResponse.builder()
                .ticketId(ticket.id())
                .ticketUrl(ticket.url())
                .created(true)
                .category(request.category())
                .escalationReason(request.escalationReason())
                .build());
    }

    @PostMapping("/append-note")
    @Operation(summary = "Append a 4-line note to an existing ticket")
    public ResponseEntity<AppendNoteResponse> appendNote(@Valid @RequestBody AppendNoteRequest request) {
        NoteAppendResult result = ticketOrchestrator.appendNote(request.getTicketId(), request.getNote(),
                request.getAuthor());
        return ResponseEntity.ok(AppendNoteResponse.builder()
                .ticketId(request.getTicketId())
                .success(result.success())
                .message(result.message())
                .build());
    }

    @PostMapping("/oa-handoff")
    @Operation(summary = "Render, find or create, and append in one call")
    public ResponseEntity<HandoffResponse> handoff(@Valid @RequestBody HandoffRequest request) {
        return ResponseEntity.ok(ticketOrchestrator.handoff(request));
    }

    private TicketRequest toTicketRequest(TicketCommand command) {
        String description = noteProcessor.sanitize(command.getDescription());
        return TicketRequest.builder()
                .description(description)
                .category(command.getCategory() != null
                        ? command.getCategory()
                        : noteProcessor.inferCategory(description))
                .escalationReason(command.getEscalationReason() != null
                        ? command.getEscalationReason()
                        : noteProcessor.inferReason(description))
                .callerNumber(command.getCallerNumber())
                .correlationKey(command.getOaKey())
                .source(command.getSource() != null ? command.getSource() : Source.Other)
                .metadata(Map.of())
                .build();
    }
}
