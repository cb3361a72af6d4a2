package com.taskpilot.engine.action;

import com.taskpilot.engine.llm.ActionDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process action registry.
 *
 * Every {@link Action} bean is collected at startup. The registry looks
 * actions up by name, produces the definitions advertised to the LLM, and
 * times and counts each execution:
 * <pre>
 *   taskpilot.action.calls{action, status="success|invalid_input|not_found|rejected|error"}
 *   taskpilot.action.duration{action}
 * </pre>
 */
@Component
public class ActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, Action> actions = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public ActionRegistry(List<Action> allActions, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Action action : allActions) {
            actions.put(action.name(), action);
            log.info("Registered action '{}'", action.name());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Action get(String name) {
        Action action = actions.get(name);
        if (action == null) {
            throw new ActionNotFoundException(name);
        }
        return action;
    }

    public boolean contains(String name) {
        return actions.containsKey(name);
    }

    /** Definitions of every registered action, sorted by name. */
    public List<ActionDefinition> definitions() {
        return actions.values().stream()
                .map(Action::definition)
                .sorted(Comparator.comparing(ActionDefinition::name))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a named action.
     *
     * @throws ActionNotFoundException if no such action is registered
     * @throws ActionException         when the action rejects its input
     */
    public String execute(String name, Map<String, Object> args, ActionContext ctx) {
        Action action = get(name);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return action.execute(args, ctx);
        } catch (ActionException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("taskpilot.action.duration", "action", name));
            meterRegistry.counter("taskpilot.action.calls", "action", name, "status", status).increment();
        }
    }
}
