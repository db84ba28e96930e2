package com.handoff.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "handoff.rate-limit")
@Data
public class RateLimitProperties {

    private Ingest ingest = new Ingest();

    @Data
    public static class Ingest {
        private int limitPerSecond = 10;
        private long timeoutMs = 0;
        private long retryAfterSeconds = 1;
        private long idleEvictionMs = 300_000;
    }
}
