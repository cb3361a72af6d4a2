package com.taskpilot.engine.support;

import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskStatus;

import java.lang.reflect.Field;
import java.time.Instant;
import java.util.UUID;

/** Factories for tasks outside a persistence context. */
public final class TestTasks {

    private TestTasks() {}

    public static Task task(String title, TaskStatus status) {
        Task task = new Task(title, "Description of " + title);
        // Reflectively set the id since it's normally set by JPA on persist
        setId(task, UUID.randomUUID());
        task.setStatus(status);
        return task;
    }

    public static Task task(String title, TaskStatus status, Instant updatedAt) {
        Task task = task(title, status);
        task.setUpdatedAt(updatedAt);
        return task;
    }

    public static void setId(Task task, UUID id) {
        try {
            Field f = Task.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(task, id);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(e);
        }
    }
}
