package com.handoff.backend.config;

import com.handoff.backend.exception.HelpdeskException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class HelpdeskResilienceConfig {

    @Bean
    public CircuitBreaker helpdeskCircuitBreaker(
            @Value("${handoff.helpdesk.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${handoff.helpdesk.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${handoff.helpdesk.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .ignoreException(HelpdeskResilienceConfig::isClientError)
                .build();
        return CircuitBreaker.of("helpdesk", config);
    }

    /**
     * Applied to history reads only. Ticket creation and note appends are not safe to repeat.
     */
    @Bean
    public Retry helpdeskReadRetry(
            @Value("${handoff.helpdesk.resilience.retry.max-attempts:3}") int maxAttempts,
            @Value("${handoff.helpdesk.resilience.retry.base-delay-ms:500}") long baseDelayMs,
            @Value("${handoff.helpdesk.resilience.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryOnException(HelpdeskResilienceConfig::isTransient)
                .build();
        return Retry.of("helpdesk-read", config);
    }

    /**
     * A 4xx other than 429 says the request was wrong, not that the helpdesk is unhealthy.
     */
    static boolean isClientError(Throwable throwable) {
        if (throwable instanceof HelpdeskException helpdeskException) {
            int status = helpdeskException.getStatusCode();
            return status >= 400 && status < 500 && status != 429;
        }
        return false;
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof HelpdeskException helpdeskException) {
            return helpdeskException.isTimeout()
                    || helpdeskException.getStatusCode() < 0
                    || helpdeskException.getStatusCode() >= 500
                    || helpdeskException.getStatusCode() == 429;
        }
        return false;
    }
}
