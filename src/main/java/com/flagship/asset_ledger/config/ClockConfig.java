package com.flagship.asset_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Ledger time source. Record timestamps are read from this clock as epoch seconds.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
