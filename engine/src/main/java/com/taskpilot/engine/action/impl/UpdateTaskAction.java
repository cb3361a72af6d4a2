package com.taskpilot.engine.action.impl;

import com.taskpilot.engine.action.Action;
import com.taskpilot.engine.action.ActionContext;
import com.taskpilot.engine.action.ActionException;
import com.taskpilot.engine.llm.ActionDefinition;
import com.taskpilot.engine.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Request the outcome of the current task.
 *
 *   done      → the task completes as DONE
 *   cancelled → the task completes as CANCELLED
 *   waiting   → the task is deferred to WAITING and re-examined later
 *
 * The request is recorded on the {@link ActionContext}; the scheduler applies
 * it when the execution ends. Only {@code status} is accepted, so the
 * permission pattern of a call is always {@code update_task(status=<value>)}.
 */
@Component
public class UpdateTaskAction implements Action {

    private static final List<String> ALLOWED = List.of("done", "cancelled", "waiting");

    private static final ActionDefinition DEFINITION = new ActionDefinition(
            "update_task",
            "Set the final status of the task you are working on. Use 'waiting' when the task depends on "
                    + "an external event; it will be picked up again later.",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "status", Map.of("type", "string", "enum", ALLOWED)),
                    "required", List.of("status"),
                    "additionalProperties", false));

    @Override
    public ActionDefinition definition() { return DEFINITION; }

    @Override
    public String execute(Map<String, Object> args, ActionContext ctx) {
        Object raw = args.get("status");
        String status = raw == null ? "" : raw.toString().trim().toLowerCase();
        if (!ALLOWED.contains(status)) {
            throw new ActionException(ActionException.Kind.INVALID_INPUT,
                    "Invalid status '" + raw + "'. Valid options: " + ALLOWED);
        }
        TaskStatus target = TaskStatus.valueOf(status.toUpperCase());
        ctx.requestStatus(target, "Agent requested status " + status);
        return "Task status will be set to " + status + " when this execution ends.";
    }
}
