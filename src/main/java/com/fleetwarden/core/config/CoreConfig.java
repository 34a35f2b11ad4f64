package com.fleetwarden.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans for the core services.
 */
@Configuration
public class CoreConfig {

    /** System clock; tests construct services with a controllable clock instead. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    public EnvSettings envSettings() {
        return EnvSettings.system();
    }
}
