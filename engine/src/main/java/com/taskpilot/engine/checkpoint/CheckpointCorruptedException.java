package com.taskpilot.engine.checkpoint;

import java.util.UUID;

/**
 * A stored checkpoint could not be deserialized. Never retried.
 */
public class CheckpointCorruptedException extends RuntimeException {

    private final UUID taskId;

    public CheckpointCorruptedException(UUID taskId, Throwable cause) {
        super("Checkpoint for task " + taskId + " is corrupted: " + cause.getMessage(), cause);
        this.taskId = taskId;
    }

    public UUID getTaskId() { return taskId; }
}
