package com.budgetpacing.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Every time decision reads this clock, in the configured pacing zone. */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(PacingProperties properties) {
        return Clock.system(properties.getMonitoring().getZone());
    }
}
