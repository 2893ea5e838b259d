package com.example.thumbgen_backend.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator replicateHealth(ReplicateProperties props) {
        return () -> {
            Health.Builder builder = props.hasToken() ? Health.up() : Health.down();
            return builder
                    .withDetail("baseUrl", props.getBaseUrl())
                    .withDetail("tokenConfigured", props.hasToken())
                    .withDetail("webhookSigning", props.hasWebhookSecret())
                    .build();
        };
    }

    @Bean
    public HealthIndicator llmHealth(LlmProperties props) {
        return () -> Health.up()
                .withDetail("model", props.getModel())
                .withDetail("bypass", props.isBypass())
                .withDetail("keyConfigured", props.getApiKey() != null && !props.getApiKey().isBlank())
                .build();
    }
}
