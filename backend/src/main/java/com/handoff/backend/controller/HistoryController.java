package com.handoff.backend.controller;

import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.EscalationStatus;
import com.handoff.backend.service.analytics.HistoryQueryService;
import com.handoff.backend.service.analytics.HistoryQueryService.EscalationListResult;
import com.handoff.backend.service.analytics.HistoryQueryService.TicketSearchResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
@Tag(name = "History")
public class HistoryController {

    private final HistoryQueryService historyQueryService;

    @GetMapping("/tickets")
    @Operation(summary = "Tickets created in a date range, optionally for one customer")
    public TicketSearchResult searchTickets(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate begin,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) String billId) {
        return historyQueryService.searchTickets(begin, end, billId);
    }

    @GetMapping("/escalations")
    @Operation(summary = "Escalations opened in a date range, optionally filtered by status")
    public EscalationListResult listEscalations(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate begin,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) EscalationStatus status) {
        return historyQueryService.listEscalations(begin, end, status);
    }

    @GetMapping("/escalations/{escalationId}")
    @Operation(summary = "One escalation by id")
    public EscalationHistoryRecord getEscalation(@PathVariable String escalationId) {
        return historyQueryService.getEscalation(escalationId);
    }
}
