package com.copilot.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.config.AppProperties;
import com.copilot.gateway.dto.claude.ClaudeRequest;
import com.copilot.gateway.dto.claude.ClaudeResponse;
import com.copilot.gateway.dto.claude.ContentBlock;
import com.copilot.gateway.dto.claude.StopReason;
import com.copilot.gateway.dto.openai.ChatCompletionRequest;
import com.copilot.gateway.dto.openai.ChatCompletionResponse;
import com.copilot.gateway.model.ModelRenamer;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ClaudeResponseTranslatorTest {

    private final AppProperties properties = new AppProperties();
    private final ModelRenamer renamer = new ModelRenamer(true, Map.of());
    private final ClaudeRequestTranslator requestTranslator = new ClaudeRequestTranslator(renamer, properties);
    private final ClaudeResponseTranslator responseTranslator = new ClaudeResponseTranslator(renamer, properties);

    @Test
    void shouldReturnDateStrippedModelForTextReply() {
        ClaudeRequest request = ClaudeRequest.parse(JSONObject.parseObject("""
                {"model":"claude-sonnet-4-5-20250115","messages":[{"role":"user","content":"hi"}]}
                """));
        ChatCompletionRequest backendRequest = requestTranslator.translate(request);
        assertThat(backendRequest.model()).isEqualTo("claude-sonnet-4.5");

        ChatCompletionResponse backendResponse = response("""
                {
                  "id": "chatcmpl-1",
                  "model": "claude-sonnet-4.5",
                  "choices": [{"index": 0, "message": {"role": "assistant", "content": "Hello there"}, "finish_reason": "stop"}],
                  "usage": {"prompt_tokens": 12, "completion_tokens": 3}
                }
                """);

        JSONObject json = responseTranslator.translate(backendResponse, backendRequest.model(), false).toJson();

        assertThat(json.getString("model")).isEqualTo("claude-sonnet-4-5");
        assertThat(json.getString("type")).isEqualTo("message");
        assertThat(json.getString("role")).isEqualTo("assistant");
        assertThat(json.getString("stop_reason")).isEqualTo("end_turn");
        assertThat(json.getJSONArray("content")).hasSize(1);
        assertThat(json.getJSONArray("content").getJSONObject(0))
                .isEqualTo(JSONObject.of("type", "text", "text", "Hello there"));
        assertThat(json.getJSONObject("usage").getLongValue("input_tokens")).isEqualTo(12);
        assertThat(json.getJSONObject("usage").getLongValue("output_tokens")).isEqualTo(3);
        assertThat(json.getJSONObject("usage").containsKey("cache_read_input_tokens")).isFalse();
    }

    @Test
    void shouldPreserveToolIdCorrelationAcrossRoundTrip() {
        ClaudeRequest firstTurn = ClaudeRequest.parse(JSONObject.parseObject("""
                {
                  "model": "claude-sonnet-4-5",
                  "tools": [{"name": "get_weather", "input_schema": {"type": "object"}}],
                  "messages": [{"role": "user", "content": "weather in Paris?"}]
                }
                """));
        ChatCompletionRequest backendRequest = requestTranslator.translate(firstTurn);

        // Copilot 有时把文本和工具调用放在不同 choice 中
        ChatCompletionResponse backendResponse = response("""
                {
                  "id": "chatcmpl-2",
                  "model": "claude-sonnet-4.5",
                  "choices": [
                    {"index": 0, "message": {"role": "assistant", "content": "Checking."}, "finish_reason": "stop"},
                    {"index": 1, "message": {"role": "assistant", "tool_calls": [
                      {"id": "toolu_vrtx_01", "type": "function", "function": {"name": "get_weather", "arguments": "{\\"city\\":\\"Paris\\"}"}}
                    ]}, "finish_reason": "tool_calls"}
                  ]
                }
                """);

        ClaudeResponse claudeResponse = responseTranslator.translate(backendResponse, backendRequest.model(), false);

        assertThat(claudeResponse.stopReason()).isEqualTo(StopReason.TOOL_USE);
        assertThat(claudeResponse.content()).hasSize(2);
        assertThat(claudeResponse.content().get(0)).isEqualTo(new ContentBlock.Text("Checking."));
        ContentBlock.ToolUse toolUse = (ContentBlock.ToolUse) claudeResponse.content().get(1);
        assertThat(toolUse.id()).isEqualTo("toolu_vrtx_01");
        assertThat(toolUse.input().getString("city")).isEqualTo("Paris");

        // 客户端把 tool_use 原样带回，并附上 tool_result
        JSONObject secondTurn = JSONObject.of(
                "model", "claude-sonnet-4-5",
                "messages", JSONArray.of(
                        JSONObject.of("role", "user", "content", "weather in Paris?"),
                        JSONObject.of("role", "assistant", "content", toJsonArray(claudeResponse)),
                        JSONObject.of("role", "user", "content", JSONArray.of(JSONObject.of(
                                "type", "tool_result", "tool_use_id", toolUse.id(), "content", "18C")))));
        JSONArray messages = requestTranslator.translate(ClaudeRequest.parse(secondTurn)).toJson().getJSONArray("messages");

        JSONObject assistant = messages.getJSONObject(1);
        assertThat(assistant.getString("content")).isEqualTo("Checking.");
        assertThat(assistant.getJSONArray("tool_calls").getJSONObject(0).getString("id")).isEqualTo("toolu_vrtx_01");
        assertThat(messages.getJSONObject(2).getString("role")).isEqualTo("tool");
        assertThat(messages.getJSONObject(2).getString("tool_call_id")).isEqualTo("toolu_vrtx_01");
    }

    @Test
    void shouldFallBackToEmptyInputForMalformedArguments() {
        ChatCompletionResponse backendResponse = response("""
                {
                  "model": "gpt-4o",
                  "choices": [{"message": {"tool_calls": [
                    {"function": {"name": "broken", "arguments": "{not json"}}
                  ]}, "finish_reason": "tool_calls"}]
                }
                """);

        ClaudeResponse claudeResponse = responseTranslator.translate(backendResponse, "gpt-4o", false);

        ContentBlock.ToolUse toolUse = (ContentBlock.ToolUse) claudeResponse.content().get(0);
        assertThat(toolUse.input()).isEmpty();
        assertThat(toolUse.id()).startsWith("toolu_");
        assertThat(claudeResponse.id()).startsWith("msg_");
    }

    @Test
    void shouldMapFinishReasons() {
        assertThat(StopReason.fromFinishReason("stop")).isEqualTo(StopReason.END_TURN);
        assertThat(StopReason.fromFinishReason("length")).isEqualTo(StopReason.MAX_TOKENS);
        assertThat(StopReason.fromFinishReason("tool_calls")).isEqualTo(StopReason.TOOL_USE);
        assertThat(StopReason.fromFinishReason("content_filter")).isEqualTo(StopReason.REFUSAL);
        assertThat(StopReason.fromFinishReason("weird").wireValue()).isEqualTo("end_turn");
    }

    @Test
    void shouldSplitThinkingTagsWhenRequested() {
        ChatCompletionResponse backendResponse = response("""
                {
                  "model": "claude-sonnet-4.5",
                  "choices": [{"message": {"content": "<thinking>add them</thinking>\\n\\n4"}, "finish_reason": "stop"}],
                  "usage": {"prompt_tokens": 20, "completion_tokens": 5, "prompt_tokens_details": {"cached_tokens": 8}}
                }
                """);

        ClaudeResponse withThinking = responseTranslator.translate(backendResponse, "claude-sonnet-4.5", true);
        ClaudeResponse withoutThinking = responseTranslator.translate(backendResponse, "claude-sonnet-4.5", false);

        assertThat(withThinking.content()).hasSize(2);
        ContentBlock.Thinking thinking = (ContentBlock.Thinking) withThinking.content().get(0);
        assertThat(thinking.thinking()).isEqualTo("add them");
        assertThat(thinking.signature()).startsWith("sig_");
        assertThat(withThinking.content().get(1)).isEqualTo(new ContentBlock.Text("\n\n4"));
        assertThat(withThinking.usage().inputTokens()).isEqualTo(12);
        assertThat(withThinking.usage().cacheReadInputTokens()).isEqualTo(8);

        assertThat(withoutThinking.content()).containsExactly(new ContentBlock.Text("<thinking>add them</thinking>\n\n4"));
    }

    @Test
    void shouldNeverEmitThinkingWhenEmulationDisabled() {
        properties.getThinking().setEmulate(false);
        ChatCompletionResponse backendResponse = response("""
                {
                  "model": "claude-sonnet-4.5",
                  "choices": [{"message": {"content": "<thinking>x</thinking>y", "reasoning_text": "native"}, "finish_reason": "stop"}]
                }
                """);

        ClaudeResponse claudeResponse = responseTranslator.translate(backendResponse, "claude-sonnet-4.5", true);

        assertThat(claudeResponse.content()).allMatch(block -> block instanceof ContentBlock.Text);
    }

    private static ChatCompletionResponse response(String json) {
        return ChatCompletionResponse.parse(JSONObject.parseObject(json));
    }

    private static JSONArray toJsonArray(ClaudeResponse response) {
        JSONArray array = new JSONArray();
        for (ContentBlock block : response.content()) {
            array.add(block.toJson());
        }
        return array;
    }
}
