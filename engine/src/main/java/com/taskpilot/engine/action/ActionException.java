package com.taskpilot.engine.action;

/**
 * An action could not do what was asked of it.
 *
 * Not a task failure: the engine reports the message to the LLM as an error
 * observation and lets the model correct itself.
 */
public class ActionException extends RuntimeException {

    public enum Kind { INVALID_INPUT, NOT_FOUND, REJECTED }

    private final Kind kind;

    public ActionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ActionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
