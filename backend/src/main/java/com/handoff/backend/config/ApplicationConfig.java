package com.handoff.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.handoff.backend.security.AuthGuard;
import com.handoff.backend.service.IdempotencyGuard;
import com.handoff.backend.service.TicketDeduper;
import com.handoff.backend.service.classifier.KeywordNoteClassifier;
import com.handoff.backend.service.classifier.NoteClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans: the clock every TTL depends on, the in-memory stores and the note classifier.
 */
@Configuration
@RequiredArgsConstructor
public class ApplicationConfig {

    private final HandoffProperties handoffProperties;
    private final SecurityProperties securityProperties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NoteClassifier noteClassifier() {
        return new KeywordNoteClassifier();
    }

    @Bean(destroyMethod = "close")
    public IdempotencyGuard idempotencyGuard(Clock clock, ObjectMapper objectMapper) {
        HandoffProperties.Idempotency idempotency = handoffProperties.getIdempotency();
        return new IdempotencyGuard(idempotency.getTtl(), clock, idempotency.getSweepInterval(), objectMapper);
    }

    @Bean(destroyMethod = "close")
    public TicketDeduper ticketDeduper(Clock clock) {
        HandoffProperties.Dedup dedup = handoffProperties.getDedup();
        return new TicketDeduper(dedup.getWindow(), clock, dedup.getSweepInterval());
    }

    @Bean(destroyMethod = "close")
    public AuthGuard authGuard(Clock clock) {
        return new AuthGuard(securityProperties.getAuth(), clock);
    }
}
