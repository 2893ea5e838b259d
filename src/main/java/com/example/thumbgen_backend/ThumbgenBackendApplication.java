package com.example.thumbgen_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ThumbgenBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThumbgenBackendApplication.class, args);
    }
}
