package com.example.thumbgen_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Pipeline and identity settings, plus the UTC clock every timestamp and timeout is read from.
 */
@Configuration
@EnableConfigurationProperties({ThumbnailProperties.class, IdentityProperties.class})
public class AppPropertiesConfig {

    @Bean
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
