package com.heronix.attendance.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wall-clock source for every date and time decision (gate, window, edits).
 */
@Configuration
public class AppConfig {

    @Bean
    public Clock systemClock() {
        return Clock.system(ZoneId.systemDefault());
    }
}
