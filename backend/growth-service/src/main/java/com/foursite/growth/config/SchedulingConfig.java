package com.foursite.growth.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the showcase and reconciliation jobs
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "growth.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
