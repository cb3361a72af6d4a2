package com.taskpilot.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Anthropic Messages API settings ({@code taskpilot.llm.*}).
 */
@ConfigurationProperties(prefix = "taskpilot.llm")
public record LlmProperties(
        String apiKey,
        @DefaultValue("claude-sonnet-4-6") String model,
        @DefaultValue("4096") int maxTokens,
        @DefaultValue("https://api.anthropic.com") String baseUrl,
        @DefaultValue("120s") Duration requestTimeout) {
}
