package com.taskpilot.engine.llm;

import java.util.Map;

/**
 * One action the LLM asked to run.
 *
 * @param id        provider-assigned id; the matching {@link ActionResult} must carry it back
 * @param name      action name, e.g. "update_task"
 * @param arguments decoded JSON arguments
 */
public record ActionCall(String id, String name, Map<String, Object> arguments) {

    public ActionCall {
        arguments = arguments == null ? Map.of() : arguments;
    }
}
