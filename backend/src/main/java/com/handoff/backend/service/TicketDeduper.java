package com.handoff.backend.service;

import com.handoff.backend.model.TicketRecord;
import com.handoff.backend.util.ExpiringMap;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Remembers recently created tickets so a repeated handoff lands on the same ticket.
 * <p>
 * The correlation key is consulted before caller+category, so it wins when the two disagree.
 * Records older than the recency window are treated as absent.
 */
@Slf4j
public class TicketDeduper implements AutoCloseable {

    private final ExpiringMap<String, TicketRecord> tickets;

    public TicketDeduper(Duration window, Clock clock, Duration sweepInterval) {
        this.tickets = new ExpiringMap<>("ticket-dedup", window, clock, sweepInterval);
    }

    public Optional<TicketRecord> find(DedupKeys keys) {
        return match(keys).map(Match::record);
    }

    /**
     * Like {@link #find(DedupKeys)} but also reports which key produced the hit.
     */
    public Optional<Match> match(DedupKeys keys) {
        for (String key : keys.all()) {
            Optional<TicketRecord> hit = tickets.get(key);
            if (hit.isPresent()) {
                log.debug("Dedup hit on {} -> {}", key, hit.get().ticketId());
                return Optional.of(new Match(key, key.equals(keys.correlationKey()), hit.get()));
            }
        }
        return Optional.empty();
    }

    public void remember(DedupKeys keys, TicketRecord record) {
        for (String key : keys.all()) {
            tickets.put(key, record);
        }
    }

    public int evictExpired() {
        return tickets.evictExpired();
    }

    public int size() {
        return tickets.size();
    }

    @Override
    public void close() {
        tickets.close();
    }

    public record Match(String key, boolean byCorrelation, TicketRecord record) {
    }
}
