package com.handoff.backend.service;

import com.handoff.backend.config.HandoffProperties;
import com.handoff.backend.dto.HandoffRequest;
import com.handoff.backend.dto.HandoffResponse;
import com.handoff.backend.exception.HelpdeskException;
import com.handoff.backend.exception.NoteAppendException;
import com.handoff.backend.model.Source;
import com.handoff.backend.model.TicketRecord;
import com.handoff.backend.service.helpdesk.HelpdeskClient;
import com.handoff.backend.service.helpdesk.HelpdeskTicket;
import com.handoff.backend.service.helpdesk.NewTicket;
import com.handoff.backend.service.helpdesk.NoteAppendResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Find-or-create-then-append.
 * <p>
 * Concurrent requests sharing any dedup key are coalesced: the first claims all of its keys and calls the
 * helpdesk, the others wait for its outcome and then pick the ticket up from the deduper instead of creating a
 * second one. Coalescing is per process.
 */
@Slf4j
@Service
public class TicketOrchestrator {

    private final NoteProcessor noteProcessor;
    private final TicketDeduper ticketDeduper;
    private final HelpdeskClient helpdeskClient;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Duration coalesceTimeout;
    private final String defaultAuthor;
    private final Map<String, CompletableFuture<TicketResolution>> inFlight = new ConcurrentHashMap<>();

    public TicketOrchestrator(NoteProcessor noteProcessor,
                              TicketDeduper ticketDeduper,
                              HelpdeskClient helpdeskClient,
                              MetricsService metricsService,
                              Clock clock,
                              HandoffProperties properties) {
        this.noteProcessor = noteProcessor;
        this.ticketDeduper = ticketDeduper;
        this.helpdeskClient = helpdeskClient;
        this.metricsService = metricsService;
        this.clock = clock;
        this.coalesceTimeout = properties.getOrchestrator().getCoalesceTimeout();
        this.defaultAuthor = properties.getOrchestrator().getDefaultAuthor();
    }

    /**
     * Render the note, find or create the ticket, then append the note to it.
     */
    public HandoffResponse handoff(HandoffRequest request) {
        ResolvedNote resolved = noteProcessor.resolve(request.getNote(), request.getSummary(),
                request.getCategory(), request.getEscalationReason(), request.getConfidence());
        log.info("Processing handoff oaKey={} caller={} category={} reason={} source={}",
                request.getOaKey(), request.getCallerNumber(), resolved.category(), resolved.reason(),
                request.getSource());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("confidence", resolved.confidence());
        metadata.put("ingestedAt", clock.instant().toString());
        TicketResolution ticket = findOrCreate(TicketRequest.builder()
                .description(resolved.note())
                .category(resolved.category())
                .escalationReason(resolved.reason())
                .callerNumber(request.getCallerNumber())
                .correlationKey(request.getOaKey())
                .source(request.getSource() != null ? request.getSource() : Source.Other)
                .metadata(metadata)
                .build());

        appendToResolvedTicket(ticket, resolved.note(), defaultAuthor);

        log.info("Handoff completed ticket={} created={}", ticket.ticketId(), ticket.created());
        return HandoffResponse.builder()
                .status("ok")
                .created(ticket.created())
                .ticketId(ticket.ticketId())
                .ticketUrl(ticket.ticketUrl())
                .category(resolved.category())
                .escalationReason(resolved.reason())
                .confidence(resolved.confidence())
                .echo(new HandoffResponse.Echo(request.getOaKey(), request.getCallerNumber()))
                .build();
    }

    public TicketResolution findOrCreate(TicketRequest request) {
        DedupKeys keys = DedupKeys.of(request.correlationKey(), request.callerNumber(), request.category());
        if (keys.isEmpty()) {
            log.debug("No dedup key available, creating a new ticket");
            return create(request, keys);
        }

        Optional<TicketResolution> known = lookup(keys);
        if (known.isPresent()) {
            return known.get();
        }

        // Every key is claimed, in sorted order, so requests sharing any one key serialize on it.
        List<String> claimKeys = keys.all().stream().sorted().toList();
        CompletableFuture<TicketResolution> claim = new CompletableFuture<>();
        long deadline = System.nanoTime() + coalesceTimeout.toNanos();
        try {
            while (true) {
                Map.Entry<String, CompletableFuture<TicketResolution>> held = claimAll(claimKeys, claim);
                if (held == null) {
                    break;
                }
                metricsService.incrementCoalescedRequests();
                log.info("Waiting on in-flight ticket creation for {}", held.getKey());
                TicketResolution leaderResult = await(held.getKey(), held.getValue(), deadline);
                Optional<TicketResolution> shared = lookup(keys);
                if (shared.isPresent()) {
                    claim.complete(shared.get());
                    return shared.get();
                }
                log.debug("Leader on {} finished with {} but left no match, retrying", held.getKey(),
                        leaderResult.ticketId());
            }

            // another request may have finished between the lookup and the claim
            TicketResolution resolution = lookup(keys).orElseGet(() -> create(request, keys));
            claim.complete(resolution);
            return resolution;
        } catch (RuntimeException ex) {
            claim.completeExceptionally(ex);
            throw ex;
        } finally {
            release(claimKeys, claim);
        }
    }

    public HelpdeskTicket createTicketDirect(TicketRequest request) {
        log.info("Creating ticket directly (no deduplication) category={}", request.category());
        HelpdeskTicket ticket = helpdeskClient.createTicket(toNewTicket(request));
        metricsService.incrementTicketsCreated();
        return ticket;
    }

    public NoteAppendResult appendNote(String ticketId, String note, String author) {
        noteProcessor.requireValid(note);
        String effectiveAuthor = author == null || author.isBlank() ? defaultAuthor : author;
        log.info("Appending note to ticket {}", ticketId);
        NoteAppendResult result = helpdeskClient.appendNote(ticketId, note, effectiveAuthor);
        if (!result.success()) {
            throw new HelpdeskException("appendNote", "Helpdesk refused note for ticket " + ticketId + ": "
                    + result.message());
        }
        return result;
    }

    private void appendToResolvedTicket(TicketResolution ticket, String note, String author) {
        try {
            NoteAppendResult result = helpdeskClient.appendNote(ticket.ticketId(), note, author);
            if (!result.success()) {
                throw new HelpdeskException("appendNote", result.message());
            }
        } catch (RuntimeException ex) {
            HelpdeskException cause = ex instanceof HelpdeskException helpdeskException
                    ? helpdeskException
                    : new HelpdeskException("appendNote", ex.getMessage(), ex);
            metricsService.incrementNoteAppendFailures();
            log.error("Note append failed for ticket {} (created={}): {}", ticket.ticketId(), ticket.created(),
                    cause.getMessage());
            throw new NoteAppendException(ticket.ticketId(), ticket.ticketUrl(), ticket.created(), cause);
        }
    }

    /**
     * Claims every key or none. Returns the first foreign claim met, after releasing whatever was taken.
     */
    private Map.Entry<String, CompletableFuture<TicketResolution>> claimAll(
            List<String> claimKeys, CompletableFuture<TicketResolution> claim) {
        List<String> taken = new ArrayList<>(claimKeys.size());
        for (String key : claimKeys) {
            CompletableFuture<TicketResolution> leader = inFlight.putIfAbsent(key, claim);
            if (leader != null && leader != claim) {
                release(taken, claim);
                return Map.entry(key, leader);
            }
            taken.add(key);
        }
        return null;
    }

    private void release(List<String> claimKeys, CompletableFuture<TicketResolution> claim) {
        for (String key : claimKeys) {
            inFlight.remove(key, claim);
        }
    }

    private Optional<TicketResolution> lookup(DedupKeys keys) {
        return ticketDeduper.match(keys).map(match -> {
            TicketRecord record = match.record();
            String matchedOn = match.byCorrelation() ? "correlation" : "caller_category";
            metricsService.incrementTicketsDeduplicated(matchedOn);
            log.info("Found existing ticket {} by {}", record.ticketId(), matchedOn);
            return new TicketResolution(record.ticketId(), record.ticketUrl(), false, record.category());
        });
    }

    private TicketResolution create(TicketRequest request, DedupKeys keys) {
        HelpdeskTicket ticket;
        try {
            ticket = helpdeskClient.createTicket(toNewTicket(request));
        } catch (HelpdeskException ex) {
            log.error("Ticket creation failed, nothing remembered: {}", ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Ticket creation failed, nothing remembered: {}", ex.getMessage());
            throw new HelpdeskException("createTicket", "Ticket creation failed: " + ex.getMessage(), ex);
        }
        if (!keys.isEmpty()) {
            ticketDeduper.remember(keys, TicketRecord.builder()
                    .ticketId(ticket.id())
                    .ticketUrl(ticket.url())
                    .createdAt(clock.instant())
                    .correlationKey(request.correlationKey())
                    .callerNumber(request.callerNumber())
                    .category(request.category())
                    .build());
        }
        metricsService.incrementTicketsCreated();
        log.info("Created new ticket {}", ticket.id());
        return new TicketResolution(ticket.id(), ticket.url(), true, request.category());
    }

    private TicketResolution await(String claimKey, CompletableFuture<TicketResolution> leader, long deadline) {
        try {
            return leader.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new HelpdeskException("findOrCreate",
                    "Timed out waiting for in-flight ticket creation on " + claimKey, -1, true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HelpdeskException("findOrCreate", "Interrupted waiting for ticket creation on " + claimKey, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof HelpdeskException helpdeskException) {
                throw helpdeskException;
            }
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new HelpdeskException("findOrCreate", "Ticket creation failed on " + claimKey, e.getCause());
        }
    }

    private NewTicket toNewTicket(TicketRequest request) {
        return NewTicket.builder()
                .description(request.description())
                .category(request.category())
                .escalationReason(request.escalationReason())
                .callerNumber(request.callerNumber())
                .source(request.source() != null ? request.source() : Source.Other)
                .metadata(request.metadata() != null ? request.metadata() : Map.of())
                .build();
    }
}
