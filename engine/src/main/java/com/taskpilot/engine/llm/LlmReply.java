package com.taskpilot.engine.llm;

import java.util.List;

/**
 * The LLM's answer to one turn: either a terminal text answer or a list of
 * action calls (possibly with some accompanying text).
 */
public record LlmReply(String text, List<ActionCall> actionCalls) {

    public LlmReply {
        actionCalls = actionCalls == null ? List.of() : List.copyOf(actionCalls);
    }

    public static LlmReply answer(String text) {
        return new LlmReply(text, List.of());
    }

    public static LlmReply actions(List<ActionCall> calls) {
        return new LlmReply(null, calls);
    }

    /** True when the model requested no further actions. */
    public boolean isFinal() {
        return actionCalls.isEmpty();
    }
}
