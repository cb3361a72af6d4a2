package com.taskpilot.engine.action.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.engine.action.Action;
import com.taskpilot.engine.action.ActionContext;
import com.taskpilot.engine.action.ActionException;
import com.taskpilot.engine.action.TaskViews;
import com.taskpilot.engine.llm.ActionDefinition;
import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskStatus;
import com.taskpilot.engine.store.TaskStore;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * List tasks, most recently updated first, optionally filtered by status.
 */
@Component
public class GetTasksAction implements Action {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT     = 100;

    private static final ActionDefinition DEFINITION = new ActionDefinition(
            "get_tasks",
            "List tasks, most recently updated first.",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "status", Map.of(
                                    "type", "string",
                                    "enum", Arrays.stream(TaskStatus.values()).map(s -> s.name().toLowerCase()).toList()),
                            "limit", Map.of("type", "integer", "minimum", 1, "maximum", MAX_LIMIT))));

    private final TaskStore    taskStore;
    private final ObjectMapper json;

    public GetTasksAction(TaskStore taskStore, ObjectMapper json) {
        this.taskStore = taskStore;
        this.json      = json;
    }

    @Override
    public ActionDefinition definition() { return DEFINITION; }

    @Override
    public String execute(Map<String, Object> args, ActionContext ctx) {
        Set<TaskStatus> statuses = EnumSet.allOf(TaskStatus.class);
        Object status = args.get("status");
        if (status != null) {
            try {
                statuses = EnumSet.of(TaskStatus.valueOf(status.toString().trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new ActionException(ActionException.Kind.INVALID_INPUT,
                        "Invalid status '" + status + "'. Valid options: " + Arrays.toString(TaskStatus.values()));
            }
        }

        int limit = DEFAULT_LIMIT;
        Object rawLimit = args.get("limit");
        if (rawLimit instanceof Number n) {
            limit = n.intValue();
        } else if (rawLimit != null) {
            try {
                limit = Integer.parseInt(rawLimit.toString().trim());
            } catch (NumberFormatException e) {
                throw new ActionException(ActionException.Kind.INVALID_INPUT, "limit must be an integer: " + rawLimit);
            }
        }
        limit = Math.max(1, Math.min(limit, MAX_LIMIT));

        List<Task> tasks = taskStore.listRecent(statuses, limit);
        try {
            return "Found " + tasks.size() + " tasks: "
                    + json.writerWithDefaultPrettyPrinter().writeValueAsString(tasks.stream().map(TaskViews::summary).toList());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render task list", e);
        }
    }
}
