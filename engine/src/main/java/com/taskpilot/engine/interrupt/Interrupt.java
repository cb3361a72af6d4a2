package com.taskpilot.engine.interrupt;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Raised when an execution reaches a boundary that needs a human.
 *
 * Interrupts are never stored on their own. The router turns one into a
 * comment plus a NEEDS_REVIEW transition, and the engine keeps it inside the
 * checkpoint until the human answers. The {@code type} property is the
 * discriminant in that JSON; a payload with a type this build does not know
 * deserializes to {@link UnrecognizedInterrupt}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = UnrecognizedInterrupt.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ToolApprovalRequest.class, name = "tool_approval_request"),
        @JsonSubTypes.Type(value = UserQuestion.class,        name = "user_question")
})
public sealed interface Interrupt permits ToolApprovalRequest, UserQuestion, UnrecognizedInterrupt {

    InterruptKind kind();
}
