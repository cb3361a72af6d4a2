package com.taskpilot.engine.action;

import com.taskpilot.engine.llm.ActionDefinition;

import java.util.Map;

/**
 * A capability the LLM can invoke during a task's action loop.
 *
 * Implementations are Spring {@code @Component}s and are collected by
 * {@link ActionRegistry}. The definition is advertised to the LLM verbatim,
 * so its description and input schema are the whole contract the model sees.
 *
 * Permission checks happen in the execution engine before {@link #execute}
 * is called; an action never checks its own permission.
 */
public interface Action {

    /** Name, description and JSON input schema shown to the LLM. */
    ActionDefinition definition();

    default String name() {
        return definition().name();
    }

    /**
     * Run the action and return the observation fed back to the LLM.
     *
     * @throws ActionException when the input is unusable; the message goes back to the LLM
     */
    String execute(Map<String, Object> args, ActionContext ctx);
}
