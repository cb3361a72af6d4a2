package com.taskpilot.engine.interrupt;

import com.taskpilot.engine.config.AgentProperties;
import com.taskpilot.engine.config.RouterProperties;
import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskComment;
import com.taskpilot.engine.model.TaskStatus;
import com.taskpilot.engine.retry.RetryPolicy;
import com.taskpilot.engine.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns a suspended execution's {@link Interrupt} into task side effects:
 * an audit comment explaining what the engine needs, then IN_PROGRESS → NEEDS_REVIEW.
 *
 *   ToolApprovalRequest   → "requesting permission to use tool" + canonical pattern
 *   UserQuestion          → "requesting human input" + the question verbatim
 *   anything else         → generic "requesting human input"
 *
 * Store calls are retried on transient failures. A failure that survives the
 * retries is logged and reported through the return value; the task is left
 * in its pre-interrupt status so the scheduler's recovery scan can route it again.
 * A comment left by an attempt whose status write failed is not posted twice.
 */
@Component
public class InterruptRouter {

    private static final Logger log = LoggerFactory.getLogger(InterruptRouter.class);

    private final TaskStore   taskStore;
    private final RetryPolicy retryPolicy;
    private final String      author;

    public InterruptRouter(TaskStore taskStore, RouterProperties routerProps, AgentProperties agentProps) {
        this.taskStore   = taskStore;
        this.author      = agentProps.author();
        this.retryPolicy = RetryPolicy.builder()
                .maxRetries(Math.max(0, routerProps.maxAttempts() - 1))
                .baseDelay(routerProps.backoff())
                .maxDelay(routerProps.backoff().multipliedBy(10))
                .build();
    }

    /**
     * Route one interrupt. Never throws.
     *
     * @return true if both the comment and the status change were written
     */
    public boolean route(Task task, Interrupt interrupt) {
        String comment = commentFor(interrupt);
        try {
            if (alreadyPosted(task, comment)) {
                log.info("Interrupt comment already on task {}; not posting it again", task.getId());
            } else {
                retryPolicy.run("Append interrupt comment to task " + task.getId(),
                        () -> taskStore.appendComment(task.getId(), author, comment));
            }
            retryPolicy.run("Move task " + task.getId() + " to NEEDS_REVIEW",
                    () -> taskStore.updateStatus(task.getId(), TaskStatus.NEEDS_REVIEW));
            log.info("Task {} moved to NEEDS_REVIEW ({})", task.getId(), describe(interrupt));
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to route {} for task {}; left for the next cycle", describe(interrupt), task.getId(), e);
            return false;
        }
    }

    /** A previous routing attempt wrote the comment but not the status. */
    private boolean alreadyPosted(Task task, String comment) {
        List<TaskComment> comments = task.getComments();
        if (comments == null || comments.isEmpty()) {
            return false;
        }
        TaskComment last = comments.get(comments.size() - 1);
        return author.equals(last.getAuthor()) && comment.equals(last.getContent());
    }

    // -------------------------------------------------------------------------
    // Comment text
    // -------------------------------------------------------------------------

    String commentFor(Interrupt interrupt) {
        return switch (interrupt.kind()) {
            case TOOL_APPROVAL_REQUEST -> author + " is requesting permission to use tool:\n\n"
                    + "- " + ((ToolApprovalRequest) interrupt).pattern() + "\n\n"
                    + "⏸️ Task paused - please approve/deny to continue processing.";
            case USER_QUESTION         -> questionComment(((UserQuestion) interrupt).questionText());
            case UNKNOWN               -> genericComment();
        };
    }

    private String questionComment(String question) {
        if (question == null || question.isBlank()) {
            return genericComment();
        }
        return author + " is requesting human input:\n\n"
                + question + "\n\n"
                + "⏸️ Task paused - please respond to continue processing.";
    }

    private String genericComment() {
        return author + " is requesting human input. Please respond to continue processing.";
    }

    private static String describe(Interrupt interrupt) {
        return switch (interrupt.kind()) {
            case TOOL_APPROVAL_REQUEST -> "tool approval request for " + ((ToolApprovalRequest) interrupt).pattern();
            case USER_QUESTION         -> "user question";
            case UNKNOWN               -> "unrecognized interrupt, treated as user question";
        };
    }
}
