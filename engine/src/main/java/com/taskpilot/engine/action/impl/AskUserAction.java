package com.taskpilot.engine.action.impl;

import com.taskpilot.engine.action.Action;
import com.taskpilot.engine.action.ActionContext;
import com.taskpilot.engine.llm.ActionDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Descriptor for the escalation action.
 *
 * The execution engine intercepts every call to {@code ask_user} and turns it
 * into a {@link com.taskpilot.engine.interrupt.UserQuestion} interrupt, so
 * {@link #execute} is never reached from the loop.
 */
@Component
public class AskUserAction implements Action {

    public static final String NAME = "ask_user";

    private static final ActionDefinition DEFINITION = new ActionDefinition(
            NAME,
            "Ask the user a question when you need input, a decision or clarification. "
                    + "The task pauses until the user answers; the answer is returned as this action's result. "
                    + "Give enough context, since the question is all the user sees.",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "question", Map.of("type", "string", "description", "The question for the user")),
                    "required", List.of("question")));

    @Override
    public ActionDefinition definition() { return DEFINITION; }

    @Override
    public String execute(Map<String, Object> args, ActionContext ctx) {
        throw new UnsupportedOperationException("ask_user suspends the execution and is never executed directly");
    }
}
