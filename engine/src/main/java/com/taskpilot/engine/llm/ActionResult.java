package com.taskpilot.engine.llm;

/**
 * Observation fed back to the LLM for one {@link ActionCall}.
 */
public record ActionResult(String callId, String content, boolean error) {

    public static ActionResult ok(String callId, String content) {
        return new ActionResult(callId, content, false);
    }

    public static ActionResult error(String callId, String content) {
        return new ActionResult(callId, content, true);
    }
}
