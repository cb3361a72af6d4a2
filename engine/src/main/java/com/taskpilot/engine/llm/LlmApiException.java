package com.taskpilot.engine.llm;

/**
 * Non-2xx response from the LLM provider.
 */
public class LlmApiException extends RuntimeException {

    private final int statusCode;

    public LlmApiException(int statusCode, String body) {
        super("LLM API error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }

    /** Rate limits, timeouts, overload (529) and server errors are worth another try. */
    public boolean isRetryable() {
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }
}
