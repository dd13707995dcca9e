package com.claimsledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Source of "today" for closed dates, default transaction dates and default
 * report dates.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${claimsledger.time-zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
