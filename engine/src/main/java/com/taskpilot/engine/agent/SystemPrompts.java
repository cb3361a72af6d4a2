package com.taskpilot.engine.agent;

import com.taskpilot.engine.config.AgentProperties;
import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskComment;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Prompts for the task-processing agent.
 *
 * The system prompt is fixed; the first user message describes the task,
 * its context and its comment thread.
 */
@Component
public class SystemPrompts {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final String name;

    public SystemPrompts(AgentProperties props) {
        this.name = props.author();
    }

    public String system() {
        return SYSTEM_PROMPT.replace("{{NAME}}", name);
    }

    /**
     * First user message for a fresh execution.
     *
     * @param humanReply a reply to inject when the task is resumed without a checkpoint; may be null
     */
    public String initialPrompt(Task task, String humanReply) {
        StringBuilder sb = new StringBuilder();
        sb.append("Current task:\n");
        sb.append("- ID: ").append(task.getId()).append('\n');
        sb.append("- Title: ").append(task.getTitle()).append('\n');
        sb.append("- Description: ").append(task.getDescription() == null ? "No description" : task.getDescription()).append('\n');
        sb.append("- Status: ").append(task.getStatus().name().toLowerCase()).append('\n');
        if (task.getCreatedAt() != null) sb.append("- Created: ").append(TIMESTAMP.format(task.getCreatedAt())).append('\n');
        if (task.getUpdatedAt() != null) sb.append("- Updated: ").append(TIMESTAMP.format(task.getUpdatedAt())).append('\n');
        if (task.getTags() != null && !task.getTags().isEmpty()) {
            sb.append("- Tags: ").append(String.join(", ", task.getTags())).append('\n');
        }
        if (task.getMetadata() != null && !task.getMetadata().isEmpty()) {
            sb.append("\nTask context:\n");
            task.getMetadata().forEach((k, v) -> sb.append("- ").append(k).append(": ").append(v).append('\n'));
        }

        sb.append("\nComments:\n");
        if (task.getComments().isEmpty()) {
            sb.append("No comments yet\n");
        } else {
            for (TaskComment c : task.getComments()) {
                sb.append("- ").append(c.getAuthor());
                if (c.getCreatedAt() != null) sb.append(" (").append(TIMESTAMP.format(c.getCreatedAt())).append(')');
                sb.append(": ").append(c.getContent()).append('\n');
            }
        }

        if (humanReply != null) {
            sb.append("\nThe user has responded to your last request:\n").append(humanReply).append('\n');
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------

    private static final String SYSTEM_PROMPT = """
            You are {{NAME}}, an assistant that processes tasks from a task board autonomously.

            Work through the task using the actions available to you:
              - Read the task and related tasks to understand what is needed.
              - Add comments to record your analysis, progress and results.
              - Call ask_user when you need a decision, an approval or clarification.
                The task pauses until the user answers.
              - Some actions need the user's approval. If an action is not yet approved,
                the task pauses and resumes once the user has decided.

            Finishing:
              - When the task is complete, call update_task with status "done".
              - If the task depends on something outside your control, call update_task
                with status "waiting"; it will be picked up again later.
              - Do not make assumptions about unclear requirements; ask instead.

            When you reply without calling any action, your reply is taken as the final answer
            for this task.
            """;
}
