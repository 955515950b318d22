package com.everrich.reconciliation.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the escalation sweep and analytics jobs. Tests switch it off with
 * {@code reconciliation.scheduling.enabled=false} and drive the jobs directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "reconciliation.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
