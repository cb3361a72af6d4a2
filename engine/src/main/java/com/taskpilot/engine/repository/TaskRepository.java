package com.taskpilot.engine.repository;

import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + polling queries for the tasks table.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    /**
     * Load a task together with its comment thread.
     * The engine reads comments outside the transaction, so they must be fetched eagerly here.
     */
    @EntityGraph(attributePaths = "comments")
    Optional<Task> findWithCommentsById(UUID id);

    /** Candidates for the next poll, oldest first. Priority between statuses is applied by the caller. */
    List<Task> findByStatusInOrderByUpdatedAtAsc(Collection<TaskStatus> statuses);

    /** Most recently touched tasks in the given statuses (status reporting). */
    List<Task> findByStatusInOrderByUpdatedAtDesc(Collection<TaskStatus> statuses, Pageable page);
}
