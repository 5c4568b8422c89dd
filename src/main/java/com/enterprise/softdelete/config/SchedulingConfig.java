package com.enterprise.softdelete.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the poll, stall-recovery, metrics and cleanup schedules.
 * Disabled in tests, which drive the processor directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(
    prefix = "cascade-delete.processor",
    name = "scheduling-enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class SchedulingConfig {
}
