package com.cashflow.simulator.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(CashflowProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
