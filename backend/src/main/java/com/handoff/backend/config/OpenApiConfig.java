package com.handoff.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI handoffOpenApi() {
        SecurityScheme tokenScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name("X-Auth-Token");
        SecurityScheme signatureScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name("X-Signature")
                .description("sha256=<hex HMAC-SHA256(secret, X-Timestamp + raw body)>, with X-Timestamp in epoch millis");
        return new OpenAPI()
                .info(new Info()
                        .title("Handoff Bridge API")
                        .version("1.0"))
                .components(new Components()
                        .addSecuritySchemes("authToken", tokenScheme)
                        .addSecuritySchemes("signedPayload", signatureScheme))
                .addSecurityItem(new SecurityRequirement().addList("authToken"))
                .addSecurityItem(new SecurityRequirement().addList("signedPayload"));
    }
}
