package com.taskpilot.engine.action;

import com.taskpilot.engine.llm.ActionDefinition;
import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskStatus;
import com.taskpilot.engine.support.TestTasks;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionRegistryTest {

    /** Echoes its input, or fails the way the arguments ask it to. */
    static class EchoAction implements Action {
        private final String name;

        EchoAction(String name) { this.name = name; }

        @Override
        public ActionDefinition definition() {
            return new ActionDefinition(name, "Echo the text back", Map.of("type", "object"));
        }

        @Override
        public String execute(Map<String, Object> args, ActionContext ctx) {
            if (args.containsKey("reject")) {
                throw new ActionException(ActionException.Kind.REJECTED, "not allowed");
            }
            if (args.containsKey("crash")) {
                throw new IllegalStateException("crashed");
            }
            return "echo: " + args.get("text");
        }
    }

    SimpleMeterRegistry meters;
    ActionRegistry registry;
    ActionContext ctx;

    @BeforeEach
    void setUp() {
        meters   = new SimpleMeterRegistry();
        registry = new ActionRegistry(List.of(new EchoAction("zeta"), new EchoAction("alpha")), meters);
        Task task = TestTasks.task("Registry test", TaskStatus.IN_PROGRESS);
        ctx      = new ActionContext(task, "taskpilot");
    }

    private double calls(String action, String status) {
        return meters.counter("taskpilot.action.calls", "action", action, "status", status).count();
    }

    @Test
    void definitions_areSortedByName() {
        assertThat(registry.definitions()).extracting(ActionDefinition::name).containsExactly("alpha", "zeta");
    }

    @Test
    void execute_success_isCountedAndTimed() {
        assertThat(registry.execute("alpha", Map.of("text", "hi"), ctx)).isEqualTo("echo: hi");

        assertThat(calls("alpha", "success")).isEqualTo(1.0);
        assertThat(meters.timer("taskpilot.action.duration", "action", "alpha").count()).isEqualTo(1);
    }

    @Test
    void execute_actionException_isCountedByKindAndRethrown() {
        assertThatThrownBy(() -> registry.execute("alpha", Map.of("reject", true), ctx))
                .isInstanceOf(ActionException.class)
                .hasMessage("not allowed");

        assertThat(calls("alpha", "rejected")).isEqualTo(1.0);
    }

    @Test
    void execute_unexpectedException_propagatesUnchanged() {
        assertThatThrownBy(() -> registry.execute("zeta", Map.of("crash", true), ctx))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("crashed");

        assertThat(calls("zeta", "error")).isEqualTo(1.0);
    }

    @Test
    void unknownAction_throwsNotFound() {
        assertThat(registry.contains("missing")).isFalse();
        assertThatThrownBy(() -> registry.execute("missing", Map.of(), ctx))
                .isInstanceOf(ActionNotFoundException.class);
    }
}
