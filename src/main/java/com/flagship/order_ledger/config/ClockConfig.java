package com.flagship.order_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * Source of event occurredAt timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
