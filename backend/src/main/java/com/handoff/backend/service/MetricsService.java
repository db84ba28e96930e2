package com.handoff.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    public void incrementTicketsCreated() {
        Counter.builder("tickets_created_total").register(meterRegistry).increment();
    }

    public void incrementTicketsDeduplicated(String matchedOn) {
        Counter.builder("tickets_deduplicated_total")
                .tag("key", matchedOn)
                .register(meterRegistry)
                .increment();
    }

    public void incrementCoalescedRequests() {
        Counter.builder("tickets_coalesced_total").register(meterRegistry).increment();
    }

    public void incrementNoteAppendFailures() {
        Counter.builder("note_append_failures_total").register(meterRegistry).increment();
    }

    public void incrementIdempotentReplays() {
        Counter.builder("idempotent_replays_total").register(meterRegistry).increment();
    }

    public void incrementRateLimitRejections() {
        Counter.builder("rate_limit_rejections_total").register(meterRegistry).increment();
    }

    public void incrementAuthFailures(String reason) {
        Counter.builder("auth_failures_total")
                .tag("reason", reason == null ? "UNKNOWN" : reason)
                .register(meterRegistry)
                .increment();
    }
}
