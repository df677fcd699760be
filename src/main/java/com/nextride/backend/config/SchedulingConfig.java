package com.nextride.backend.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the fixed-rate feed schedulers unless mta.polling.enabled is false,
 * for deployments where an external cron triggers the admin refresh endpoints
 * instead.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "mta.polling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
