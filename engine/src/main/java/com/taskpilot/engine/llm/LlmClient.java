package com.taskpilot.engine.llm;

import java.util.List;

/**
 * The LLM collaborator. Treated as a black box: one call is one turn.
 */
public interface LlmClient {

    /**
     * @param systemPrompt instructions for the whole conversation
     * @param conversation every message so far, oldest first
     * @param actions      the actions the model may call this turn
     * @throws LlmApiException on a non-2xx response; other failures surface as unchecked exceptions
     */
    LlmReply complete(String systemPrompt, List<ConversationMessage> conversation, List<ActionDefinition> actions);
}
