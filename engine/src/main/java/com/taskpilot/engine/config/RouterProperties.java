package com.taskpilot.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Retry settings for the interrupt router's task-store writes ({@code taskpilot.router.*}).
 */
@ConfigurationProperties(prefix = "taskpilot.router")
public record RouterProperties(
        @DefaultValue("3")     int      maxAttempts,
        @DefaultValue("200ms") Duration backoff) {
}
