package com.taskpilot.engine.model;

/**
 * Status of the scheduler loop itself (not of any task).
 */
public enum AgentRunStatus {
    IDLE,
    PROCESSING,
    PAUSED,
    ERROR
}
