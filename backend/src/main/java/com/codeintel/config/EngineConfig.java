package com.codeintel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans shared by the engine services.
 */
@Configuration
public class EngineConfig {

    /**
     * Eligibility newness checks read "today" from this clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
