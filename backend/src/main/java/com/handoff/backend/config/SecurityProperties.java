package com.handoff.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "handoff.security")
@Data
public class SecurityProperties {

    private Auth auth = new Auth();
    private Cors cors = new Cors();
    private boolean publicHealthEndpoint = true;

    @Data
    public static class Auth {
        /** Shared token expected in {@code X-Auth-Token}. Blank disables token mode. */
        private String token;
        /** HMAC secret for {@code X-Signature}. Blank disables signed mode. */
        private String signingSecret;
        private Duration signatureWindow = Duration.ofMinutes(5);
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>();
        private List<String> allowedMethods = List.of("GET", "POST", "OPTIONS");
    }
}
