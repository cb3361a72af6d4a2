package com.taskpilot.engine.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.engine.config.LlmProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Request/response mapping only; no network.
 */
class ClaudeClientTest {

    final ClaudeClient client = new ClaudeClient(
            new LlmProperties("test-key", "test-model", 1024, "http://localhost:1", Duration.ofSeconds(5)),
            new ObjectMapper());

    // ------------------------------------------------------------------
    // buildRequest
    // ------------------------------------------------------------------

    @Test
    @SuppressWarnings("unchecked")
    void buildRequest_mapsConversationToContentBlocks() {
        ActionCall call = new ActionCall("toolu_1", "get_tasks", Map.of("status", "new"));
        List<ConversationMessage> conversation = List.of(
                ConversationMessage.user("Current task: triage"),
                ConversationMessage.assistant("Let me look.", List.of(call)),
                ConversationMessage.results(List.of(ActionResult.error("toolu_1", "Error: store offline"))));

        Map<String, Object> body = ClaudeClient.buildRequest("test-model", 1024, "system text", conversation, List.of());

        assertThat(body).containsEntry("model", "test-model")
                .containsEntry("max_tokens", 1024)
                .containsEntry("system", "system text")
                .doesNotContainKey("tools");

        List<Map<String, Object>> messages = (List<Map<String, Object>>) body.get("messages");
        assertThat(messages).extracting(m -> m.get("role")).containsExactly("user", "assistant", "user");

        List<Map<String, Object>> assistantBlocks = (List<Map<String, Object>>) messages.get(1).get("content");
        assertThat(assistantBlocks).containsExactly(
                Map.of("type", "text", "text", "Let me look."),
                Map.of("type", "tool_use", "id", "toolu_1", "name", "get_tasks", "input", Map.of("status", "new")));

        List<Map<String, Object>> resultBlocks = (List<Map<String, Object>>) messages.get(2).get("content");
        assertThat(resultBlocks).containsExactly(Map.of(
                "type", "tool_result", "tool_use_id", "toolu_1",
                "content", "Error: store offline", "is_error", true));
    }

    @Test
    @SuppressWarnings("unchecked")
    void buildRequest_advertisesActionsAsTools() {
        ActionDefinition definition = new ActionDefinition("add_comment", "Add a comment",
                Map.of("type", "object", "required", List.of("content")));

        Map<String, Object> body = ClaudeClient.buildRequest("m", 10, "s",
                List.of(ConversationMessage.user("hi")), List.of(definition));

        assertThat((List<Map<String, Object>>) body.get("tools")).containsExactly(Map.of(
                "name", "add_comment",
                "description", "Add a comment",
                "input_schema", Map.of("type", "object", "required", List.of("content"))));
    }

    // ------------------------------------------------------------------
    // parseReply
    // ------------------------------------------------------------------

    @Test
    void parseReply_textOnly_isFinal() throws Exception {
        LlmReply reply = client.parseReply("""
                {"id":"msg_1","type":"message","role":"assistant",
                 "content":[{"type":"text","text":"All done."},{"type":"text","text":"Closing."}],
                 "stop_reason":"end_turn","usage":{"input_tokens":10,"output_tokens":4}}
                """);

        assertThat(reply.isFinal()).isTrue();
        assertThat(reply.text()).isEqualTo("All done.\nClosing.");
    }

    @Test
    void parseReply_toolUse_becomesActionCalls() throws Exception {
        LlmReply reply = client.parseReply("""
                {"content":[
                   {"type":"text","text":"Checking the board."},
                   {"type":"tool_use","id":"toolu_9","name":"get_tasks","input":{"status":"new","limit":5}}
                 ],
                 "stop_reason":"tool_use"}
                """);

        assertThat(reply.isFinal()).isFalse();
        assertThat(reply.text()).isEqualTo("Checking the board.");
        assertThat(reply.actionCalls()).containsExactly(
                new ActionCall("toolu_9", "get_tasks", Map.of("status", "new", "limit", 5)));
    }

    @Test
    void parseReply_noTextBlocks_hasNullText() throws Exception {
        LlmReply reply = client.parseReply("""
                {"content":[{"type":"tool_use","id":"toolu_2","name":"ask_user","input":{"question":"Go?"}}]}
                """);

        assertThat(reply.text()).isNull();
        assertThat(reply.actionCalls()).hasSize(1);
    }
}
