package com.taskpilot.engine.interrupt;

/** Discriminant of {@link Interrupt}. */
public enum InterruptKind {
    TOOL_APPROVAL_REQUEST,
    USER_QUESTION,
    UNKNOWN
}
