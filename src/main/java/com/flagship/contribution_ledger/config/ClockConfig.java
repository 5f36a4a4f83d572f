package com.flagship.contribution_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Event timestamps come from this clock so tests can pin time.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
