package com.handoff.backend.service.helpdesk;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.handoff.backend.config.HelpdeskProperties;
import com.handoff.backend.exception.HelpdeskException;
import com.handoff.backend.model.EscalationHistoryRecord;
import com.handoff.backend.model.TicketHistoryRecord;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JSON/REST helpdesk client.
 * <p>
 * Every call goes through the circuit breaker. Ticket creation and note appends are not idempotent on the
 * helpdesk side, so they are never retried here; history reads are.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "handoff.helpdesk", name = "mode", havingValue = "http")
public class HttpHelpdeskClient implements HelpdeskClient, HelpdeskRecordSource {

    private static final TypeReference<List<TicketHistoryRecord>> TICKET_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<EscalationHistoryRecord>> ESCALATION_LIST = new TypeReference<>() {
    };

    private final RestTemplate helpdeskRestTemplate;
    private final CircuitBreaker helpdeskCircuitBreaker;
    private final Retry helpdeskReadRetry;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper;
    private final HelpdeskProperties properties;

    @PostConstruct
    void init() {
        Gauge.builder("helpdesk_circuit_state", helpdeskCircuitBreaker, breaker -> mapState(breaker.getState()))
                .register(meterRegistry);
    }

    @Override
    public HelpdeskTicket createTicket(NewTicket ticket) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("description", ticket.description());
        body.put("category", ticket.category());
        body.put("escalationReason", ticket.escalationReason());
        body.put("callerNumber", ticket.callerNumber());
        body.put("source", ticket.source());
        body.put("metadata", ticket.metadata() == null ? Map.of() : ticket.metadata());
        JsonNode response = readTree("createTicket",
                execute("createTicket", url("/tickets"), HttpMethod.POST, body, false));
        String id = text(response, "id");
        if (id == null) {
            throw new HelpdeskException("createTicket", "Helpdesk response did not include a ticket id");
        }
        String url = text(response, "url");
        return new HelpdeskTicket(id, url != null ? url : properties.getTicketUrlBase() + "/" + id);
    }

    @Override
    public NoteAppendResult appendNote(String ticketId, String note, String author) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("note", note);
        body.put("author", author);
        String target = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/tickets/{id}/notes")
                .buildAndExpand(ticketId)
                .toUriString();
        JsonNode response = readTree("appendNote", execute("appendNote", target, HttpMethod.POST, body, false));
        boolean success = !response.has("success") || response.get("success").asBoolean();
        String message = text(response, "message");
        return new NoteAppendResult(success, message != null ? message : "Note appended to ticket " + ticketId);
    }

    @Override
    public boolean healthCheck() {
        try {
            execute("healthCheck", url("/health"), HttpMethod.GET, null, false);
            return true;
        } catch (HelpdeskException ex) {
            return false;
        }
    }

    @Override
    public List<TicketHistoryRecord> fetchTickets(LocalDate begin, LocalDate end) {
        String target = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/tickets")
                .queryParam("begin", begin)
                .queryParam("end", end)
                .toUriString();
        return readList("fetchTickets", execute("fetchTickets", target, HttpMethod.GET, null, true), TICKET_LIST);
    }

    @Override
    public List<EscalationHistoryRecord> fetchEscalations(LocalDate begin, LocalDate end) {
        String target = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/escalations")
                .queryParam("begin", begin)
                .queryParam("end", end)
                .toUriString();
        return readList("fetchEscalations", execute("fetchEscalations", target, HttpMethod.GET, null, true),
                ESCALATION_LIST);
    }

    @Override
    public Optional<EscalationHistoryRecord> fetchEscalation(String escalationId) {
        String target = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/escalations/{id}")
                .buildAndExpand(escalationId)
                .toUriString();
        String body;
        try {
            body = execute("fetchEscalation", target, HttpMethod.GET, null, true);
        } catch (HelpdeskException ex) {
            if (ex.getStatusCode() == 404) {
                return Optional.empty();
            }
            throw ex;
        }
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(body, EscalationHistoryRecord.class));
        } catch (IOException e) {
            throw new HelpdeskException("fetchEscalation", "Unreadable helpdesk response: " + e.getMessage(), e);
        }
    }

    private String execute(String operation, String url, HttpMethod method, Object body, boolean retryable) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        Supplier<String> supplier = () -> doRequest(operation, url, method, body);
        try {
            Supplier<String> decorated = retryable ? Retry.decorateSupplier(helpdeskReadRetry, supplier) : supplier;
            decorated = CircuitBreaker.decorateSupplier(helpdeskCircuitBreaker, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            recordFailure(operation, method, url, null, "CIRCUIT_OPEN", e);
            throw new HelpdeskException(operation, "Helpdesk circuit breaker open", 503, false, e);
        } catch (HelpdeskException e) {
            recordFailure(operation, method, url, e.getStatusCode(), e.isTimeout() ? "TIMEOUT" : "HTTP_ERROR", e);
            throw e;
        } finally {
            sample.stop(Timer.builder("helpdesk_call_latency")
                    .tag("operation", operation)
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(String operation, String url, HttpMethod method, Object body) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
                headers.setBearerAuth(properties.getApiKey());
            }
            if (body != null) {
                headers.setContentType(MediaType.APPLICATION_JSON);
            }
            HttpEntity<String> entity = new HttpEntity<>(body == null ? null : objectMapper.writeValueAsString(body),
                    headers);
            ResponseEntity<String> response = helpdeskRestTemplate.exchange(url, method, entity, String.class);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            throw new HelpdeskException(operation, "Helpdesk " + operation + " failed (" + e.getStatusCode().value()
                    + "): " + e.getResponseBodyAsString(), e.getStatusCode().value(), false, e);
        } catch (ResourceAccessException e) {
            boolean timeout = e.getCause() instanceof SocketTimeoutException;
            throw new HelpdeskException(operation, "Helpdesk " + operation
                    + (timeout ? " timed out" : " unreachable") + ": " + e.getMessage(), -1, timeout, e);
        } catch (RestClientException | IOException e) {
            throw new HelpdeskException(operation, "Helpdesk " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode readTree(String operation, String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new HelpdeskException(operation, "Unreadable helpdesk response: " + e.getMessage(), e);
        }
    }

    private <T> List<T> readList(String operation, String body, TypeReference<List<T>> type) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new HelpdeskException(operation, "Unreadable helpdesk response: " + e.getMessage(), e);
        }
    }

    private String url(String path) {
        return properties.getBaseUrl() + path;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private int mapState(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED -> 0;
            case OPEN -> 1;
            case HALF_OPEN -> 2;
            default -> 3;
        };
    }

    private void recordFailure(String operation, HttpMethod method, String url, Integer status, String reason,
                               Exception e) {
        log.warn("Helpdesk request failed operation={} method={} url={} status={} reason={} message={}",
                operation, method, url, status, reason, e.getMessage());
    }
}
