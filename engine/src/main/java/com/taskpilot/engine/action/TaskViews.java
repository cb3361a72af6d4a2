package com.taskpilot.engine.action;

import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskComment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-ready views of tasks, as shown to the LLM.
 */
public final class TaskViews {

    private TaskViews() {}

    /** Task fields without comments; safe on a task whose comments are not loaded. */
    public static Map<String, Object> summary(Task task) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id",          String.valueOf(task.getId()));
        view.put("title",       task.getTitle());
        view.put("description", task.getDescription());
        view.put("status",      task.getStatus().name().toLowerCase());
        view.put("tags",        task.getTags());
        view.put("metadata",    task.getMetadata());
        view.put("created_at",  String.valueOf(task.getCreatedAt()));
        view.put("updated_at",  String.valueOf(task.getUpdatedAt()));
        return view;
    }

    /** Summary plus the full comment thread. */
    public static Map<String, Object> detail(Task task) {
        Map<String, Object> view = summary(task);
        List<Map<String, Object>> comments = task.getComments().stream()
                .map(TaskViews::comment)
                .toList();
        view.put("comments", comments);
        return view;
    }

    private static Map<String, Object> comment(TaskComment c) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("author",     c.getAuthor());
        view.put("content",    c.getContent());
        view.put("created_at", String.valueOf(c.getCreatedAt()));
        return view;
    }
}
