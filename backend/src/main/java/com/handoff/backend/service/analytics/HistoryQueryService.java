package com.handoff.backend.service.analytics;

import com.handoff.backend.exception.ResourceNotFoundException;
import com.handoff.backend.exception.ValidationException;
import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.EscalationStatus;
import com.handoff.backend.model.TicketHistoryRecord;
import com.handoff.backend.service.analytics.AnalyticsService.DateRange;
import com.handoff.backend.service.helpdesk.HelpdeskRecordSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Raw history lookups over the same read-only source the analyzers use. Results are newest first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryQueryService {

    private static final Comparator<Instant> NEWEST_FIRST = Comparator.nullsLast(Comparator.reverseOrder());

    private final HelpdeskRecordSource recordSource;
    private final AnalyticsService analyticsService;

    public TicketSearchResult searchTickets(LocalDate begin, LocalDate end, String billId) {
        DateRange range = analyticsService.resolve(begin, end);
        String customer = billId == null || billId.isBlank() ? null : billId.trim();
        List<TicketHistoryRecord> tickets = recordSource.fetchTickets(range.begin(), range.end()).stream()
                .filter(ticket -> customer == null || customer.equals(ticket.billId()))
                .sorted(Comparator.comparing(TicketHistoryRecord::entryTime, NEWEST_FIRST))
                .toList();
        log.info("Ticket search complete range={} billId={} count={}", range, customer, tickets.size());
        return new TicketSearchResult(range.toString(), customer, tickets.size(), tickets);
    }

    /**
     * @param status {@code null} lists open and closed escalations alike
     */
    public EscalationListResult listEscalations(LocalDate begin, LocalDate end, EscalationStatus status) {
        DateRange range = analyticsService.resolve(begin, end);
        List<EscalationHistoryRecord> escalations = recordSource.fetchEscalations(range.begin(), range.end()).stream()
                .filter(escalation -> status == null || status.matches(escalation))
                .sorted(Comparator.comparing(EscalationHistoryRecord::entryTime, NEWEST_FIRST))
                .toList();
        log.info("Escalation list complete range={} status={} count={}", range, status, escalations.size());
        return new EscalationListResult(range.toString(), status, escalations.size(), escalations);
    }

    public EscalationHistoryRecord getEscalation(String escalationId) {
        if (escalationId == null || escalationId.isBlank()) {
            throw ValidationException.forField("escalationId", escalationId, "must not be blank");
        }
        return recordSource.fetchEscalation(escalationId.trim())
                .orElseThrow(() -> new ResourceNotFoundException("escalation", escalationId.trim()));
    }

    public record TicketSearchResult(String period, String billId, int count, List<TicketHistoryRecord> tickets) {
    }

    public record EscalationListResult(String period, EscalationStatus status, int count,
                                       List<EscalationHistoryRecord> escalations) {
    }
}
