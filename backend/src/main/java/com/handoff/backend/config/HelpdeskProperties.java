package com.handoff.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "handoff.helpdesk")
@Data
public class HelpdeskProperties {

    /** {@code mock} keeps tickets in memory, {@code http} talks to {@link #baseUrl}. */
    private String mode = "mock";
    private String baseUrl = "http://localhost:9090/api";
    private String apiKey;
    private String ticketUrlBase = "https://helpdesk.example.com/tickets";
}
