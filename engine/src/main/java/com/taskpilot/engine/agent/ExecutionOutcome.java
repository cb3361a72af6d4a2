package com.taskpilot.engine.agent;

import com.taskpilot.engine.interrupt.Interrupt;
import com.taskpilot.engine.model.TaskStatus;
import com.taskpilot.engine.retry.FailureKind;

/**
 * How one {@link ExecutionEngine#run} ended. Returned, never thrown.
 *
 *   Completed  → the loop finished; {@code status} is DONE unless the agent asked for CANCELLED
 *   Suspended  → a human is needed; the checkpoint is already durable
 *   Deferred   → the agent asked to wait for something external
 *   Failed     → an exception ended the run; {@code kind} says whether to retry
 */
public sealed interface ExecutionOutcome {

    record Completed(String finalAnswer, TaskStatus status) implements ExecutionOutcome {}

    record Suspended(Interrupt interrupt) implements ExecutionOutcome {}

    record Deferred(String reason) implements ExecutionOutcome {}

    record Failed(Throwable error, FailureKind kind) implements ExecutionOutcome {}
}
