package com.taskpilot.engine.action;

import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskStatus;

import java.util.UUID;

/**
 * Runtime context passed to every action invocation.
 *
 * Actions never write the current task's status themselves. A status the
 * agent asks for is recorded here and applied by the scheduler once the
 * engine returns.
 */
public final class ActionContext {

    private final Task   task;
    private final String author;

    private TaskStatus requestedStatus;
    private String     requestReason;

    public ActionContext(Task task, String author) {
        this.task   = task;
        this.author = author;
    }

    public Task       task()            { return task; }
    public UUID       taskId()          { return task.getId(); }
    public String     author()          { return author; }
    public TaskStatus requestedStatus() { return requestedStatus; }
    public String     requestReason()   { return requestReason; }

    public void requestStatus(TaskStatus status, String reason) {
        this.requestedStatus = status;
        this.requestReason   = reason;
    }
}
