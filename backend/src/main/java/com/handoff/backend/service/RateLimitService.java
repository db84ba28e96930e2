package com.handoff.backend.service;

import com.handoff.backend.config.RateLimitProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-identity admission control: a fixed number of operations per one-second window.
 */
@Slf4j
@Service
public class RateLimitService {

    public record RateLimitDecision(boolean allowed, long retryAfterSeconds) {
    }

    private final RateLimiterConfig ingestConfig;
    private final long retryAfterSeconds;
    private final long idleEvictionMs;
    private final Clock clock;
    private final Map<String, TrackedLimiter> limiters = new ConcurrentHashMap<>();

    public RateLimitService(RateLimitProperties properties, Clock clock) {
        RateLimitProperties.Ingest ingest = properties.getIngest();
        this.ingestConfig = RateLimiterConfig.custom()
                .limitForPeriod(ingest.getLimitPerSecond())
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ofMillis(ingest.getTimeoutMs()))
                .build();
        this.retryAfterSeconds = ingest.getRetryAfterSeconds();
        this.idleEvictionMs = ingest.getIdleEvictionMs();
        this.clock = clock;
    }

    public boolean allow(String identity) {
        return allowWithRetryAfter(identity).allowed();
    }

    public RateLimitDecision allowWithRetryAfter(String identity) {
        TrackedLimiter tracked = limiters.compute(identity, (key, existing) -> {
            RateLimiter limiter = existing != null ? existing.limiter() : RateLimiter.of("ingest-" + key, ingestConfig);
            return new TrackedLimiter(limiter, clock.millis());
        });
        boolean allowed = tracked.limiter().acquirePermission();
        return new RateLimitDecision(allowed, allowed ? 0 : retryAfterSeconds);
    }

    @Scheduled(fixedDelayString = "${handoff.rate-limit.ingest.idle-eviction-ms:300000}")
    public void evictIdleLimiters() {
        long cutoff = clock.millis() - idleEvictionMs;
        int before = limiters.size();
        limiters.entrySet().removeIf(entry -> entry.getValue().lastUsedMs() < cutoff);
        int removed = before - limiters.size();
        if (removed > 0) {
            log.debug("Evicted {} idle rate limiters", removed);
        }
    }

    int trackedIdentities() {
        return limiters.size();
    }

    private record TrackedLimiter(RateLimiter limiter, long lastUsedMs) {
    }
}
