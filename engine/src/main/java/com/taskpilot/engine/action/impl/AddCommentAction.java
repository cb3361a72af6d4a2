package com.taskpilot.engine.action.impl;

import com.taskpilot.engine.action.Action;
import com.taskpilot.engine.action.ActionContext;
import com.taskpilot.engine.action.ActionException;
import com.taskpilot.engine.llm.ActionDefinition;
import com.taskpilot.engine.store.TaskStore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Append a comment to the current task, authored by the engine.
 */
@Component
public class AddCommentAction implements Action {

    private static final ActionDefinition DEFINITION = new ActionDefinition(
            "add_comment",
            "Add a comment to the task you are working on, e.g. progress notes or a summary of your findings.",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "content", Map.of("type", "string", "description", "Comment text")),
                    "required", List.of("content")));

    private final TaskStore taskStore;

    public AddCommentAction(TaskStore taskStore) {
        this.taskStore = taskStore;
    }

    @Override
    public ActionDefinition definition() { return DEFINITION; }

    @Override
    public String execute(Map<String, Object> args, ActionContext ctx) {
        Object content = args.get("content");
        if (content == null || content.toString().isBlank()) {
            throw new ActionException(ActionException.Kind.INVALID_INPUT, "content is required");
        }
        taskStore.appendComment(ctx.taskId(), ctx.author(), content.toString());
        return "Comment added to task '" + ctx.task().getTitle() + "'.";
    }
}
