package com.taskpilot.engine.store;

import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskNotFoundException;
import com.taskpilot.engine.model.TaskStatus;
import com.taskpilot.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Postgres-backed task store.
 *
 * Besides the {@link TaskStore} operations the engine uses, this class also
 * carries the entry points external actors call: producers creating tasks,
 * humans replying to an escalation, and cancellation.
 */
@Service
public class JpaTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTaskStore.class);

    private final TaskRepository taskRepo;

    public JpaTaskStore(TaskRepository taskRepo) {
        this.taskRepo = taskRepo;
    }

    // ------------------------------------------------------------------
    // TaskStore
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public List<Task> listEligible(Collection<TaskStatus> statuses) {
        return taskRepo.findByStatusInOrderByUpdatedAtAsc(statuses);
    }

    @Override
    @Transactional(readOnly = true)
    public Task get(UUID taskId) {
        return taskRepo.findWithCommentsById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @Override
    @Transactional
    public void updateStatus(UUID taskId, TaskStatus status) {
        Task task = taskRepo.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        TaskStatus previous = task.getStatus();
        task.setStatus(status);
        taskRepo.save(task);
        log.info("Task {} status {} → {}", taskId, previous, status);
    }

    @Override
    @Transactional
    public void appendComment(UUID taskId, String author, String text) {
        Task task = taskRepo.findWithCommentsById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        task.addComment(author, text);
        taskRepo.save(task);
        log.debug("Comment by '{}' appended to task {}", author, taskId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Task> listRecent(Collection<TaskStatus> statuses, int limit) {
        return taskRepo.findByStatusInOrderByUpdatedAtDesc(statuses, PageRequest.of(0, Math.max(1, limit)));
    }

    // ------------------------------------------------------------------
    // External actors
    // ------------------------------------------------------------------

    /** Create a task in status NEW (used by producers such as the ingestion pipeline). */
    @Transactional
    public Task create(String title, String description, List<String> tags, Map<String, Object> metadata) {
        Task task = new Task(title, description);
        if (tags != null)     task.getTags().addAll(tags);
        if (metadata != null) task.getMetadata().putAll(metadata);
        Task saved = taskRepo.save(task);
        log.info("Task {} created: '{}'", saved.getId(), title);
        return saved;
    }

    /**
     * Record a human's reply to an escalation.
     *
     * Appends the reply as a comment and moves the task
     * NEEDS_REVIEW → USER_INPUT_RECEIVED so the scheduler resumes it on its next poll.
     *
     * @throws com.taskpilot.engine.model.IllegalTaskTransitionException if the task is not awaiting review
     */
    @Transactional
    public Task recordHumanResponse(UUID taskId, String author, String text) {
        Task task = taskRepo.findWithCommentsById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        task.getStatus().checkTransition(TaskStatus.USER_INPUT_RECEIVED, false);
        task.addComment(author, text);
        task.setStatus(TaskStatus.USER_INPUT_RECEIVED);
        log.info("Human response recorded on task {} by '{}'", taskId, author);
        return taskRepo.save(task);
    }

    /**
     * Cancel a non-terminal task.
     *
     * @throws com.taskpilot.engine.model.IllegalTaskTransitionException if the task is already terminal
     */
    @Transactional
    public Task cancel(UUID taskId) {
        Task task = taskRepo.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        task.getStatus().checkTransition(TaskStatus.CANCELLED, false);
        task.setStatus(TaskStatus.CANCELLED);
        log.info("Task {} cancelled", taskId);
        return taskRepo.save(task);
    }
}
