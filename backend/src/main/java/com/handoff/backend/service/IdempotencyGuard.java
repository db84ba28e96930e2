package com.handoff.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.handoff.backend.exception.IdempotencyConflictException;
import com.handoff.backend.model.IdempotencyRecord;
import com.handoff.backend.util.ExpiringMap;
import com.handoff.backend.util.HashUtils;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Replays the stored response for a repeated idempotency key and rejects a key reused for a different payload.
 * <p>
 * A key is claimed as in progress before the work runs, so a concurrent duplicate is rejected instead of
 * repeating the side effect. Only successful responses are recorded; a failure releases the claim and the
 * client may retry with the same key.
 */
@Slf4j
public class IdempotencyGuard implements AutoCloseable {

    private final ExpiringMap<String, IdempotencyRecord> records;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public IdempotencyGuard(Duration ttl, Clock clock, Duration sweepInterval, ObjectMapper objectMapper) {
        this.records = new ExpiringMap<>("idempotency", ttl, clock, sweepInterval);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public IdempotencyCheck check(String key, String payloadHash) {
        Optional<IdempotencyRecord> existing = records.get(key);
        if (existing.isEmpty()) {
            return IdempotencyCheck.miss();
        }
        return classify(existing.get(), payloadHash);
    }

    public void record(String key, String payloadHash, Object response, int statusCode) {
        records.put(key, IdempotencyRecord.builder()
                .idempotencyKey(key)
                .requestHash(payloadHash)
                .status(IdempotencyRecord.Status.COMPLETED)
                .response(response)
                .statusCode(statusCode)
                .correlationId(MDC.get("correlationId"))
                .recordedAt(clock.instant())
                .build());
    }

    public <T> IdempotentResponse<T> execute(String idempotencyKey, Object request, int successStatus,
                                             Class<T> responseType, Supplier<T> supplier) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return new IdempotentResponse<>(supplier.get(), successStatus, false);
        }
        String requestHash = hashRequest(request);
        IdempotencyRecord claim = IdempotencyRecord.builder()
                .idempotencyKey(idempotencyKey)
                .requestHash(requestHash)
                .status(IdempotencyRecord.Status.IN_PROGRESS)
                .correlationId(MDC.get("correlationId"))
                .recordedAt(clock.instant())
                .build();

        Optional<IdempotencyRecord> existing = records.putIfAbsent(idempotencyKey, claim);
        if (existing.isPresent()) {
            return replay(idempotencyKey, requestHash, existing.get(), responseType);
        }

        try {
            T response = supplier.get();
            IdempotencyRecord completed = claim.toBuilder()
                    .status(IdempotencyRecord.Status.COMPLETED)
                    .response(response)
                    .statusCode(successStatus)
                    .recordedAt(clock.instant())
                    .build();
            if (!records.replace(idempotencyKey, claim, completed)) {
                log.warn("Idempotency claim for key {} vanished before completion", idempotencyKey);
            }
            return new IdempotentResponse<>(response, successStatus, false);
        } catch (RuntimeException ex) {
            records.remove(idempotencyKey, claim);
            throw ex;
        }
    }

    public String hashRequest(Object request) {
        return HashUtils.hashPayload(objectMapper, request);
    }

    public int evictExpired() {
        return records.evictExpired();
    }

    public int size() {
        return records.size();
    }

    @Override
    public void close() {
        records.close();
    }

    private <T> IdempotentResponse<T> replay(String idempotencyKey, String requestHash, IdempotencyRecord stored,
                                             Class<T> responseType) {
        IdempotencyCheck check = classify(stored, requestHash);
        switch (check.outcome()) {
            case CONFLICT -> throw new IdempotencyConflictException(
                    "Idempotency key reused with different payload", idempotencyKey);
            case IN_PROGRESS -> throw new IdempotencyConflictException(
                    "Idempotency key already in progress", idempotencyKey);
            default -> {
            }
        }
        log.info("Idempotent replay served from cache for key {} (original correlationId={})",
                idempotencyKey, stored.correlationId());
        return new IdempotentResponse<>(responseType.cast(stored.response()), stored.statusCode(), true);
    }

    private IdempotencyCheck classify(IdempotencyRecord stored, String payloadHash) {
        if (!stored.requestHash().equals(payloadHash)) {
            return new IdempotencyCheck(IdempotencyCheck.Outcome.CONFLICT, stored);
        }
        if (stored.status() == IdempotencyRecord.Status.IN_PROGRESS) {
            return new IdempotencyCheck(IdempotencyCheck.Outcome.IN_PROGRESS, stored);
        }
        return new IdempotencyCheck(IdempotencyCheck.Outcome.HIT, stored);
    }
}
