package com.premiergroup.ad_autopilot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * "Today" for metrics and scheduled runs is the calendar day in the configured zone.
 */
@Configuration(proxyBeanMethods = false)
public class ClockConfig {

    @Bean
    public Clock clock(AutopilotProperties properties) {
        return Clock.system(ZoneId.of(properties.schedule().zone()));
    }
}
