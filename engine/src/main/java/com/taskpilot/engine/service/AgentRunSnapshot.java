package com.taskpilot.engine.service;

import com.taskpilot.engine.model.AgentRunStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable copy of {@link AgentRunState}, as reported to status consumers.
 *
 * @param currentTaskSince when the in-flight task was claimed; null when idle
 */
public record AgentRunSnapshot(
        AgentRunStatus status,
        UUID           currentTaskId,
        Instant        currentTaskSince,
        long           totalTasksProcessed,
        long           errorCount,
        long           retryCount,
        String         lastError,
        Instant        startedAt,
        Instant        lastActivity) {}
