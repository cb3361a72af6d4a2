package com.taskpilot.engine.action.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.engine.action.ActionContext;
import com.taskpilot.engine.action.ActionException;
import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskStatus;
import com.taskpilot.engine.support.InMemoryTaskStore;
import com.taskpilot.engine.support.TestTasks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * The built-in actions against an in-memory task store.
 */
class ActionsTest {

    InMemoryTaskStore store;
    Task current;
    ActionContext ctx;

    @BeforeEach
    void setUp() {
        store   = new InMemoryTaskStore();
        current = store.add(TestTasks.task("Plan the offsite", TaskStatus.IN_PROGRESS));
        ctx     = new ActionContext(current, "taskpilot");
    }

    // ------------------------------------------------------------------
    // get_task
    // ------------------------------------------------------------------

    @Test
    void getTask_defaultsToCurrentTaskAndIncludesComments() {
        current.addComment("frank", "Budget is 5k");
        GetTaskAction action = new GetTaskAction(store, new ObjectMapper());

        String output = action.execute(Map.of(), ctx);

        assertThat(output).startsWith("Task details: ")
                .contains("Plan the offsite")
                .contains("Budget is 5k")
                .contains("\"status\" : \"in_progress\"");
    }

    @Test
    void getTask_badIdOrMissingTask_isRejected() {
        GetTaskAction action = new GetTaskAction(store, new ObjectMapper());

        assertThatThrownBy(() -> action.execute(Map.of("task_id", "not-a-uuid"), ctx))
                .isInstanceOfSatisfying(ActionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ActionException.Kind.INVALID_INPUT));
        assertThatThrownBy(() -> action.execute(Map.of("task_id", UUID.randomUUID().toString()), ctx))
                .isInstanceOfSatisfying(ActionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ActionException.Kind.NOT_FOUND));
    }

    // ------------------------------------------------------------------
    // get_tasks
    // ------------------------------------------------------------------

    @Test
    void getTasks_filtersByStatusNewestFirst() {
        store.add(TestTasks.task("older done", TaskStatus.DONE, Instant.parse("2026-01-01T00:00:00Z")));
        store.add(TestTasks.task("newer done", TaskStatus.DONE, Instant.parse("2026-02-01T00:00:00Z")));
        GetTasksAction action = new GetTasksAction(store, new ObjectMapper());

        String output = action.execute(Map.of("status", "done"), ctx);

        assertThat(output).startsWith("Found 2 tasks: ").doesNotContain("Plan the offsite");
        assertThat(output.indexOf("newer done")).isLessThan(output.indexOf("older done"));
    }

    @Test
    void getTasks_limitIsClampedAndValidated() {
        for (int i = 0; i < 3; i++) {
            store.add(TestTasks.task("task " + i, TaskStatus.NEW));
        }
        GetTasksAction action = new GetTasksAction(store, new ObjectMapper());

        assertThat(action.execute(Map.of("limit", 2), ctx)).startsWith("Found 2 tasks");
        assertThat(action.execute(Map.of("limit", "0"), ctx)).startsWith("Found 1 tasks");
        assertThatThrownBy(() -> action.execute(Map.of("limit", "many"), ctx))
                .isInstanceOf(ActionException.class);
        assertThatThrownBy(() -> action.execute(Map.of("status", "archived"), ctx))
                .isInstanceOf(ActionException.class)
                .hasMessageContaining("Invalid status 'archived'");
    }

    // ------------------------------------------------------------------
    // add_comment / update_task / ask_user
    // ------------------------------------------------------------------

    @Test
    void addComment_writesAsEngineAuthor() {
        AddCommentAction action = new AddCommentAction(store);

        String output = action.execute(Map.of("content", "Venue shortlisted"), ctx);

        assertThat(output).isEqualTo("Comment added to task 'Plan the offsite'.");
        assertThat(current.getComments()).singleElement()
                .satisfies(c -> assertThat(c.getAuthor()).isEqualTo("taskpilot"));
    }

    @Test
    void updateTask_recordsRequestWithoutWritingStatus() {
        UpdateTaskAction action = new UpdateTaskAction();

        String output = action.execute(Map.of("status", "Done"), ctx);

        assertThat(output).isEqualTo("Task status will be set to done when this execution ends.");
        assertThat(ctx.requestedStatus()).isEqualTo(TaskStatus.DONE);
        assertThat(current.getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
    }

    @Test
    void updateTask_rejectsStatusesTheEngineOwns() {
        UpdateTaskAction action = new UpdateTaskAction();
        Map<String, Object> args = new HashMap<>();
        args.put("status", "needs_review");

        assertThatThrownBy(() -> action.execute(args, ctx))
                .isInstanceOf(ActionException.class)
                .hasMessageContaining("Valid options");
        assertThat(ctx.requestedStatus()).isNull();
    }

    @Test
    void askUser_isNeverExecutedDirectly() {
        assertThatThrownBy(() -> new AskUserAction().execute(Map.of("question", "?"), ctx))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
