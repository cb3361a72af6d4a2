package com.taskpilot.engine.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.engine.config.LlmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API with tool use.
 *
 * Actions are advertised as "tools". An assistant turn that wants to act comes
 * back as tool_use blocks; the results go out on the next user message as
 * tool_result blocks keyed by the tool_use id.
 *
 * Raw HttpClient keeps the wire format visible, which is what you want when
 * debugging a conversation that was restored from a checkpoint.
 */
@Component
public class ClaudeClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagesResponse(List<ContentBlock> content, String stop_reason) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record ContentBlock(String type, String text, String id, String name, Map<String, Object> input) {}
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_PATH = "/v1/messages";
    private static final String API_VER  = "2023-06-01";

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final LlmProperties props;

    public ClaudeClient(LlmProperties props, ObjectMapper objectMapper) {
        this.props = props;
        this.json  = objectMapper;
        this.http  = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // LlmClient
    // -------------------------------------------------------------------------

    @Override
    public LlmReply complete(String systemPrompt,
                             List<ConversationMessage> conversation,
                             List<ActionDefinition> actions) {
        try {
            String requestBody = json.writeValueAsString(
                    buildRequest(props.model(), props.maxTokens(), systemPrompt, conversation, actions));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(props.baseUrl() + API_PATH))
                    .timeout(props.requestTimeout())
                    .header("content-type",      "application/json")
                    .header("x-api-key",         props.apiKey())
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() / 100 != 2) {
                log.warn("LLM call failed with status {}", response.statusCode());
                throw new LlmApiException(response.statusCode(), response.body());
            }
            return parseReply(response.body());

        } catch (IOException e) {
            throw new IllegalStateException("LLM API call failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the LLM", e);
        }
    }

    // -------------------------------------------------------------------------
    // Mapping (package-private for tests)
    // -------------------------------------------------------------------------

    static Map<String, Object> buildRequest(String model,
                                            int maxTokens,
                                            String systemPrompt,
                                            List<ConversationMessage> conversation,
                                            List<ActionDefinition> actions) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",      model);
        body.put("max_tokens", maxTokens);
        body.put("system",     systemPrompt);
        body.put("messages",   conversation.stream().map(ClaudeClient::toWire).toList());
        if (!actions.isEmpty()) {
            body.put("tools", actions.stream().map(a -> Map.of(
                    "name",         a.name(),
                    "description",  a.description(),
                    "input_schema", a.inputSchema())).toList());
        }
        return body;
    }

    private static Map<String, Object> toWire(ConversationMessage m) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        if (m.text() != null && !m.text().isBlank()) {
            blocks.add(Map.of("type", "text", "text", m.text()));
        }
        for (ActionCall call : m.actionCalls()) {
            blocks.add(Map.of(
                    "type",  "tool_use",
                    "id",    call.id(),
                    "name",  call.name(),
                    "input", call.arguments()));
        }
        for (ActionResult result : m.actionResults()) {
            blocks.add(Map.of(
                    "type",        "tool_result",
                    "tool_use_id", result.callId(),
                    "content",     result.content() == null ? "" : result.content(),
                    "is_error",    result.error()));
        }
        String role = m.role() == ConversationMessage.Role.ASSISTANT ? "assistant" : "user";
        return Map.of("role", role, "content", blocks);
    }

    LlmReply parseReply(String responseBody) throws JsonProcessingException {
        MessagesResponse parsed = json.readValue(responseBody, MessagesResponse.class);
        StringBuilder text = new StringBuilder();
        List<ActionCall> calls = new ArrayList<>();
        for (MessagesResponse.ContentBlock block : parsed.content() == null
                ? List.<MessagesResponse.ContentBlock>of() : parsed.content()) {
            if ("text".equals(block.type()) && block.text() != null) {
                if (!text.isEmpty()) text.append('\n');
                text.append(block.text());
            } else if ("tool_use".equals(block.type())) {
                calls.add(new ActionCall(block.id(), block.name(), block.input()));
            }
        }
        return new LlmReply(text.isEmpty() ? null : text.toString(), calls);
    }
}
