package com.taskpilot.engine.model;

/**
 * Thrown when a status change would violate the task state machine,
 * e.g. re-entering a DONE task without a force override.
 */
public class IllegalTaskTransitionException extends RuntimeException {

    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTaskTransitionException(TaskStatus from, TaskStatus to) {
        super("Illegal task transition " + from + " → " + to);
        this.from = from;
        this.to   = to;
    }

    public TaskStatus getFrom() { return from; }
    public TaskStatus getTo()   { return to; }
}
