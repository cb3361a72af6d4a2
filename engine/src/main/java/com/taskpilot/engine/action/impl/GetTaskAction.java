package com.taskpilot.engine.action.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.engine.action.Action;
import com.taskpilot.engine.action.ActionContext;
import com.taskpilot.engine.action.ActionException;
import com.taskpilot.engine.action.TaskViews;
import com.taskpilot.engine.llm.ActionDefinition;
import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskNotFoundException;
import com.taskpilot.engine.store.TaskStore;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Read one task with its comment thread. Defaults to the current task.
 */
@Component
public class GetTaskAction implements Action {

    private static final ActionDefinition DEFINITION = new ActionDefinition(
            "get_task",
            "Get a task with all of its comments. Omit task_id to read the task you are working on.",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "task_id", Map.of("type", "string", "description", "Task UUID"))));

    private final TaskStore    taskStore;
    private final ObjectMapper json;

    public GetTaskAction(TaskStore taskStore, ObjectMapper json) {
        this.taskStore = taskStore;
        this.json      = json;
    }

    @Override
    public ActionDefinition definition() { return DEFINITION; }

    @Override
    public String execute(Map<String, Object> args, ActionContext ctx) {
        Object raw = args.get("task_id");
        UUID taskId;
        try {
            taskId = raw == null ? ctx.taskId() : UUID.fromString(raw.toString());
        } catch (IllegalArgumentException e) {
            throw new ActionException(ActionException.Kind.INVALID_INPUT, "Invalid task ID format: " + raw);
        }

        Task task;
        try {
            task = taskStore.get(taskId);
        } catch (TaskNotFoundException e) {
            throw new ActionException(ActionException.Kind.NOT_FOUND, "Task not found with ID: " + taskId);
        }

        try {
            return "Task details: " + json.writerWithDefaultPrettyPrinter().writeValueAsString(TaskViews.detail(task));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render task " + taskId, e);
        }
    }
}
