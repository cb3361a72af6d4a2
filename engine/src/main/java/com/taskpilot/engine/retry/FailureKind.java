package com.taskpilot.engine.retry;

/** How a failure is handled: retried with backoff, or surfaced as a task ERROR. */
public enum FailureKind {
    RETRYABLE,
    FATAL
}
