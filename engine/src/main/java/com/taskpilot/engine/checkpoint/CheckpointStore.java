package com.taskpilot.engine.checkpoint;

import com.taskpilot.engine.agent.ExecutionState;

import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for suspended and in-progress executions, one per task.
 */
public interface CheckpointStore {

    /**
     * Persist {@code state} for {@code taskId}, replacing any existing checkpoint.
     * The write is durable when this method returns.
     */
    void save(UUID taskId, ExecutionState state);

    /**
     * @throws CheckpointCorruptedException if a checkpoint exists but cannot be read back
     */
    Optional<ExecutionState> load(UUID taskId);

    /** Remove the checkpoint for {@code taskId}; a no-op if there is none. */
    void discard(UUID taskId);
}
