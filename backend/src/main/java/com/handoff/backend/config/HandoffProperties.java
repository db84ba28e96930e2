package com.handoff.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "handoff")
@Data
@Validated
public class HandoffProperties {

    private Idempotency idempotency = new Idempotency();
    private Dedup dedup = new Dedup();
    private Orchestrator orchestrator = new Orchestrator();

    @Data
    public static class Idempotency {
        private Duration ttl = Duration.ofMinutes(15);
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Dedup {
        private Duration window = Duration.ofHours(4);
        private Duration sweepInterval = Duration.ofMinutes(30);
    }

    @Data
    public static class Orchestrator {
        /** How long a duplicate request waits for an in-flight create on the same dedup key. */
        private Duration coalesceTimeout = Duration.ofSeconds(30);
        private String defaultAuthor = "Handoff-Agent";
    }
}
