package com.taskpilot.engine.llm;

import java.util.List;

/**
 * One entry of a conversation with the LLM.
 *
 * USER messages carry either text (prompts, notes) or the results of the
 * previous turn's action calls. ASSISTANT messages carry the model's text and
 * the action calls it requested. The whole list is what a checkpoint stores.
 */
public record ConversationMessage(
        Role               role,
        String             text,
        List<ActionCall>   actionCalls,
        List<ActionResult> actionResults) {

    public enum Role { USER, ASSISTANT }

    public ConversationMessage {
        actionCalls   = actionCalls   == null ? List.of() : List.copyOf(actionCalls);
        actionResults = actionResults == null ? List.of() : List.copyOf(actionResults);
    }

    public static ConversationMessage user(String text) {
        return new ConversationMessage(Role.USER, text, List.of(), List.of());
    }

    public static ConversationMessage assistant(String text, List<ActionCall> calls) {
        return new ConversationMessage(Role.ASSISTANT, text, calls, List.of());
    }

    public static ConversationMessage results(List<ActionResult> results) {
        return new ConversationMessage(Role.USER, null, List.of(), results);
    }
}
