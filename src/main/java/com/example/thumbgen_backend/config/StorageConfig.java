package com.example.thumbgen_backend.config;

import com.example.thumbgen_backend.service.Interfaces.StorageService;
import com.example.thumbgen_backend.service.LocalStorageService;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public StorageService storageService(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        LoggerFactory.getLogger(StorageConfig.class).info("STORAGE wired kind=local base={} publicBaseUrl={}",
                base, properties.getPublicBaseUrl());
        return new LocalStorageService(base, properties.getPublicBaseUrl());
    }
}
