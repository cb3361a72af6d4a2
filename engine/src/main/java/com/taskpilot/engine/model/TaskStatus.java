package com.taskpilot.engine.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a Task.
 *
 * Transitions:
 *   NEW / WAITING / USER_INPUT_RECEIVED → IN_PROGRESS   (claimed by the scheduler)
 *   IN_PROGRESS → DONE          (loop completed, no pending interrupt)
 *   IN_PROGRESS → NEEDS_REVIEW  (interrupt raised)
 *   IN_PROGRESS → WAITING       (loop deferred on an external event)
 *   IN_PROGRESS → ERROR         (fatal failure or retries exhausted)
 *   NEEDS_REVIEW → USER_INPUT_RECEIVED  (a human replied)
 *   any non-terminal → CANCELLED
 *
 * DONE, CANCELLED and ERROR are terminal. Leaving a terminal state requires
 * an explicit force override (see {@link #canTransitionTo(TaskStatus, boolean)}).
 */
public enum TaskStatus {
    NEW,
    IN_PROGRESS,
    NEEDS_REVIEW,
    USER_INPUT_RECEIVED,
    WAITING,
    DONE,
    CANCELLED,
    ERROR;

    /** Statuses the scheduler polls for, in selection priority order. */
    public static final Set<TaskStatus> ELIGIBLE =
            EnumSet.of(USER_INPUT_RECEIVED, NEW, WAITING);

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED || this == ERROR;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return canTransitionTo(target, false);
    }

    /**
     * @param force when true, any task (terminal or not) may be moved back to
     *              IN_PROGRESS. It has no effect on other targets.
     */
    public boolean canTransitionTo(TaskStatus target, boolean force) {
        if (target == CANCELLED) {
            return !isTerminal();
        }
        if (target == IN_PROGRESS && force) {
            return true;
        }
        return switch (this) {
            case NEW, WAITING, USER_INPUT_RECEIVED -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == DONE || target == NEEDS_REVIEW
                             || target == WAITING || target == ERROR;
            case NEEDS_REVIEW -> target == USER_INPUT_RECEIVED;
            case DONE, CANCELLED, ERROR -> false;
        };
    }

    /**
     * @throws IllegalTaskTransitionException if the move is not legal
     */
    public void checkTransition(TaskStatus target, boolean force) {
        if (!canTransitionTo(target, force)) {
            throw new IllegalTaskTransitionException(this, target);
        }
    }
}
