package com.taskpilot.engine.service;

/** Answer to {@link AgentScheduler#forceProcess}. */
public enum ForceProcessResult {
    /** The task was claimed and is running on the force worker. */
    ACCEPTED,
    /** This task is already in flight; nothing new was started. */
    ALREADY_RUNNING,
    /** Another task is in flight; single-flight forbids a second one. */
    BUSY
}
