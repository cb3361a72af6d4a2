package com.taskpilot.engine.retry;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.engine.checkpoint.CheckpointCorruptedException;
import com.taskpilot.engine.llm.LlmApiException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    @ParameterizedTest
    @ValueSource(ints = {408, 429, 500, 503, 529})
    void transientApiStatuses_areRetryable(int status) {
        assertThat(FailureClassifier.classify(new LlmApiException(status, "busy")))
                .isEqualTo(FailureKind.RETRYABLE);
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 403, 404})
    void clientApiErrors_areFatal(int status) {
        assertThat(FailureClassifier.classify(new LlmApiException(status, "bad request")))
                .isEqualTo(FailureKind.FATAL);
    }

    @Test
    void networkFailureWrappedByClient_isRetryable() {
        RuntimeException wrapped = new IllegalStateException("LLM request failed",
                new HttpTimeoutException("request timed out"));

        assertThat(FailureClassifier.isRetryable(wrapped)).isTrue();
        assertThat(FailureClassifier.isRetryable(new IllegalStateException(new IOException("reset")))).isTrue();
    }

    @Test
    void databaseOutage_isRetryable_constraintViolationIsNot() {
        assertThat(FailureClassifier.isRetryable(new DataAccessResourceFailureException("connection refused"))).isTrue();
        assertThat(FailureClassifier.isRetryable(new DataIntegrityViolationException("duplicate key"))).isFalse();
    }

    @Test
    void corruptedCheckpoint_isFatal() {
        CheckpointCorruptedException e = new CheckpointCorruptedException(UUID.randomUUID(),
                new IllegalArgumentException("unexpected token"));

        assertThat(FailureClassifier.classify(e)).isEqualTo(FailureKind.FATAL);
    }

    @Test
    void corruptedCheckpointWrappingJacksonError_isFatal() {
        Exception cause = catchParse("{not json");
        CheckpointCorruptedException e = new CheckpointCorruptedException(UUID.randomUUID(), cause);

        assertThat(cause).isInstanceOf(IOException.class);
        assertThat(FailureClassifier.classify(e)).isEqualTo(FailureKind.FATAL);
        assertThat(FailureClassifier.classify(new IllegalStateException("wrapped", e))).isEqualTo(FailureKind.FATAL);
    }

    @Test
    void malformedLlmReply_isFatal() {
        RuntimeException wrapped = new IllegalStateException("LLM API call failed",
                new JsonParseException(null, "Unexpected end-of-input"));

        assertThat(FailureClassifier.isRetryable(wrapped)).isFalse();
    }

    @Test
    void programmingErrors_areFatal() {
        assertThat(FailureClassifier.classify(new NullPointerException())).isEqualTo(FailureKind.FATAL);
        assertThat(FailureClassifier.classify(new IllegalStateException("max turns"))).isEqualTo(FailureKind.FATAL);
    }

    @Test
    void describe_includesTypeAndMessage() {
        assertThat(FailureClassifier.describe(new IllegalStateException("boom")))
                .isEqualTo("IllegalStateException: boom");
        assertThat(FailureClassifier.describe(new NullPointerException()))
                .isEqualTo("NullPointerException");
    }

    private static Exception catchParse(String text) {
        try {
            new ObjectMapper().readTree(text);
        } catch (Exception e) {
            return e;
        }
        throw new AssertionError("expected a parse failure for " + text);
    }
}
