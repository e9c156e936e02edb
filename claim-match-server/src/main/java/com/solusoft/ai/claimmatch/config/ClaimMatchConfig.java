package com.solusoft.ai.claimmatch.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
public class ClaimMatchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
