package com.taskpilot.engine.store;

import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskNotFoundException;
import com.taskpilot.engine.model.TaskStatus;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * The engine's view of the task store.
 *
 * Writes are single-row and last-writer-wins; no optimistic locking is
 * expected because only one scheduler instance runs against a store.
 * Changes made by other actors (a human replying, a cancellation) are seen
 * by the engine only on its next poll.
 */
public interface TaskStore {

    /** Tasks currently in any of {@code statuses}, least recently updated first. */
    List<Task> listEligible(Collection<TaskStatus> statuses);

    /**
     * Load one task with its full comment thread.
     *
     * @throws TaskNotFoundException if no such task exists
     */
    Task get(UUID taskId);

    void updateStatus(UUID taskId, TaskStatus status);

    void appendComment(UUID taskId, String author, String text);

    /** Most recently updated tasks in {@code statuses}, newest first. Comments are not loaded. */
    List<Task> listRecent(Collection<TaskStatus> statuses, int limit);
}
