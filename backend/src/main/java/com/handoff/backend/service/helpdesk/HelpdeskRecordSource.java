package com.handoff.backend.service.helpdesk;

import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.TicketHistoryRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only history used by analytics. Both bounds are inclusive.
 */
public interface HelpdeskRecordSource {

    List<TicketHistoryRecord> fetchTickets(LocalDate begin, LocalDate end);

    List<EscalationHistoryRecord> fetchEscalations(LocalDate begin, LocalDate end);

    /**
     * @return empty when the helpdesk has no escalation with that id
     */
    Optional<EscalationHistoryRecord> fetchEscalation(String escalationId);
}
