package com.penny.ledger.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public Clock ledgerClock(PennyProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
