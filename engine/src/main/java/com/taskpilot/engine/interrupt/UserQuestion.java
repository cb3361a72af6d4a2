package com.taskpilot.engine.interrupt;

/**
 * The LLM escalated with a question for a human.
 */
public record UserQuestion(String questionText) implements Interrupt {

    @Override
    public InterruptKind kind() { return InterruptKind.USER_QUESTION; }
}
