package com.handoff.backend.service.helpdesk;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("helpdesk")
@RequiredArgsConstructor
public class HelpdeskHealthIndicator implements HealthIndicator {

    private final HelpdeskClient helpdeskClient;

    @Override
    public Health health() {
        boolean reachable = helpdeskClient.healthCheck();
        Health.Builder builder = reachable ? Health.up() : Health.down();
        return builder.withDetail("client", helpdeskClient.getClass().getSimpleName()).build();
    }
}
