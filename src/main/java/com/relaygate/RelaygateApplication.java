package com.relaygate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for Relaygate - OpenAI-compatible LLM gateway with caching,
 * provider fallback and cost accounting.
 */
@SpringBootApplication
@EnableScheduling
public class RelaygateApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelaygateApplication.class, args);
    }
}
