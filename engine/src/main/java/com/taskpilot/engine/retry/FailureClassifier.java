package com.taskpilot.engine.retry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.taskpilot.engine.checkpoint.CheckpointCorruptedException;
import com.taskpilot.engine.llm.LlmApiException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;

/**
 * Sorts failures into {@link FailureKind#RETRYABLE} and {@link FailureKind#FATAL}.
 *
 * Transient connectivity problems with the LLM or the database are retryable,
 * wherever they sit in the cause chain. Everything else, checkpoint
 * corruption included, is fatal.
 */
public final class FailureClassifier {

    private FailureClassifier() {}

    public static FailureKind classify(Throwable error) {
        return isRetryable(error) ? FailureKind.RETRYABLE : FailureKind.FATAL;
    }

    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            // Unreadable payloads are IOExceptions too but never heal on retry.
            if (current instanceof CheckpointCorruptedException
                    || current instanceof JsonProcessingException) {
                return false;
            }
            if (current instanceof LlmApiException api) {
                return api.isRetryable();
            }
            if (current instanceof IOException
                    || current instanceof HttpTimeoutException
                    || current instanceof TransientDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof CannotCreateTransactionException) {
                return true;
            }
            if (current.getCause() == current) break;
            current = current.getCause();
        }
        return false;
    }

    /** Short, single-line description for comments and the run state. */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank()
                ? error.getClass().getSimpleName()
                : error.getClass().getSimpleName() + ": " + message;
    }
}
