package com.example.netorchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    /**
     * Single source of "now" for timestamps, transition timing and analysis windows.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
