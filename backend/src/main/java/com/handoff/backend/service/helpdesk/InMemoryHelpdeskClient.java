package com.handoff.backend.service.helpdesk;

import com.handoff.backend.config.HelpdeskProperties;
import com.handoff.backend.exception.HelpdeskException;
import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.TicketHistoryRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Helpdesk stand-in that keeps tickets in memory. Used when no real helpdesk is configured.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "handoff.helpdesk", name = "mode", havingValue = "mock", matchIfMissing = true)
public class InMemoryHelpdeskClient implements HelpdeskClient, HelpdeskRecordSource {

    private final AtomicLong sequence = new AtomicLong(1000);
    private final Map<String, StoredTicket> tickets = new ConcurrentHashMap<>();
    private final List<TicketHistoryRecord> ticketHistory = new CopyOnWriteArrayList<>();
    private final List<EscalationHistoryRecord> escalationHistory = new CopyOnWriteArrayList<>();
    private final String ticketUrlBase;
    private final Clock clock;

    public InMemoryHelpdeskClient(HelpdeskProperties properties, Clock clock) {
        this.ticketUrlBase = properties.getTicketUrlBase();
        this.clock = clock;
    }

    @Override
    public HelpdeskTicket createTicket(NewTicket ticket) {
        String id = "TKT-" + sequence.getAndIncrement();
        String url = ticketUrlBase + "/" + id;
        Instant now = clock.instant();
        tickets.put(id, new StoredTicket(id, url, ticket, new CopyOnWriteArrayList<>()));
        ticketHistory.add(TicketHistoryRecord.builder()
                .ticketId(id)
                .entryTime(now)
                .service(ticket.source() != null ? ticket.source().name() : "Other")
                .category(ticket.category() != null ? ticket.category().name() : "Unknown")
                .billId(ticket.callerNumber())
                .description(ticket.description())
                .build());
        log.info("Created in-memory ticket {} category={}", id, ticket.category());
        return new HelpdeskTicket(id, url);
    }

    @Override
    public NoteAppendResult appendNote(String ticketId, String note, String author) {
        StoredTicket stored = tickets.get(ticketId);
        if (stored == null) {
            throw new HelpdeskException("appendNote", "Ticket " + ticketId + " not found", 404, false, null);
        }
        stored.notes().add(author + ": " + note);
        log.info("Appended note to in-memory ticket {} ({} chars)", ticketId, note.length());
        return new NoteAppendResult(true, "Note appended to ticket " + ticketId);
    }

    @Override
    public boolean healthCheck() {
        return true;
    }

    @Override
    public List<TicketHistoryRecord> fetchTickets(LocalDate begin, LocalDate end) {
        return ticketHistory.stream()
                .filter(record -> within(record.entryTime(), begin, end))
                .toList();
    }

    @Override
    public List<EscalationHistoryRecord> fetchEscalations(LocalDate begin, LocalDate end) {
        return escalationHistory.stream()
                .filter(record -> within(record.entryTime(), begin, end))
                .toList();
    }

    @Override
    public Optional<EscalationHistoryRecord> fetchEscalation(String escalationId) {
        return escalationHistory.stream()
                .filter(record -> escalationId.equals(record.escalationId()))
                .findFirst();
    }

    public void addTicketHistory(List<TicketHistoryRecord> records) {
        ticketHistory.addAll(records);
    }

    public void addEscalationHistory(List<EscalationHistoryRecord> records) {
        escalationHistory.addAll(records);
    }

    public List<String> notesFor(String ticketId) {
        StoredTicket stored = tickets.get(ticketId);
        return stored == null ? List.of() : new ArrayList<>(stored.notes());
    }

    public int ticketCount() {
        return tickets.size();
    }

    private boolean within(Instant time, LocalDate begin, LocalDate end) {
        if (time == null) {
            return false;
        }
        LocalDate day = time.atZone(ZoneOffset.UTC).toLocalDate();
        return !day.isBefore(begin) && !day.isAfter(end);
    }

    private record StoredTicket(String id, String url, NewTicket request, List<String> notes) {
    }
}
