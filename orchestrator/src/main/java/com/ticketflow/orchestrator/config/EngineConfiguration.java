package com.ticketflow.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    // Injected everywhere timestamps are taken so tests can pin time.
    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}
