package com.copilot.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.dto.claude.ClaudeUsage;
import com.copilot.gateway.dto.claude.StopReason;
import com.copilot.gateway.dto.claude.StreamEvent;
import com.copilot.gateway.dto.openai.ChatCompletionResponse;
import com.copilot.gateway.exception.UpstreamException;
import com.copilot.gateway.model.ModelRenamer;
import com.copilot.gateway.translator.ClaudeStreamTranslator;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClaudeControllerTest {

    private final ModelRenamer renamer = new ModelRenamer(true, Map.of());

    @Test
    void shouldTranslateDataEventsIntoAnthropicEvents() {
        Flux<String> upstream = Flux.just(
                """
                {"id":"c1","model":"claude-sonnet-4.5","choices":[{"index":0,"delta":{"content":"Hi"}}]}""",
                """
                {"id":"c1","choices":[{"index":0,"delta":{},"finish_reason":"stop"}]}""");

        StepVerifier.create(ClaudeController.streamEvents(upstream, translator()).map(StreamEvent::eventType))
                .expectNext("message_start", "content_block_start", "content_block_delta", "content_block_stop",
                        "message_delta", "message_stop")
                .verifyComplete();
    }

    @Test
    void shouldCloseStreamWhenUpstreamEndsWithoutFinishReason() {
        Flux<String> upstream = Flux.just("""
                {"choices":[{"index":0,"delta":{"content":"partial"}}]}""");

        StepVerifier.create(ClaudeController.streamEvents(upstream, translator()).map(StreamEvent::eventType))
                .expectNext("message_start", "content_block_start", "content_block_delta", "content_block_stop",
                        "message_delta", "message_stop")
                .verifyComplete();
    }

    @Test
    void shouldSkipChunkWithUnexpectedShapeAndKeepStreaming() {
        Flux<String> upstream = Flux.just(
                """
                {"choices":[{"index":0,"delta":{"content":"Hi"}}]}""",
                """
                {"choices":[null]}""",
                """
                {"choices":[{"index":0,"delta":{"content":" there"},"finish_reason":"stop"}]}""");

        StepVerifier.create(ClaudeController.streamEvents(upstream, translator()).map(StreamEvent::eventType))
                .expectNext("message_start", "content_block_start", "content_block_delta", "content_block_delta",
                        "content_block_stop", "message_delta", "message_stop")
                .verifyComplete();
    }

    @Test
    void shouldEmitSingleErrorEventWhenUpstreamBreaks() {
        Flux<String> upstream = Flux.concat(
                Flux.just("""
                        {"choices":[{"index":0,"delta":{"content":"partial"}}]}"""),
                Flux.error(new IOException("connection reset")));

        StepVerifier.create(ClaudeController.streamEvents(upstream, translator()))
                .expectNextMatches(e -> e instanceof StreamEvent.MessageStart)
                .expectNextMatches(e -> e instanceof StreamEvent.ContentBlockStart)
                .expectNextMatches(e -> e instanceof StreamEvent.ContentBlockDelta)
                .assertNext(e -> {
                    assertThat(e).isInstanceOf(StreamEvent.Error.class);
                    assertThat(((StreamEvent.Error) e).message()).contains("connection reset");
                })
                .verifyComplete();
    }

    @Test
    void shouldFormatEventAsSseFrame() {
        String frame = ClaudeController.formatEvent(new StreamEvent.MessageDelta(StopReason.TOOL_USE, new ClaudeUsage(3, 4, 0)));

        assertThat(frame).startsWith("event: message_delta\ndata: ").endsWith("\n\n");
        JSONObject data = JSONObject.parseObject(frame.substring(frame.indexOf("data: ") + 6).trim());
        assertThat(data.getJSONObject("delta").getString("stop_reason")).isEqualTo("tool_use");
        assertThat(data.getJSONObject("usage").getIntValue("output_tokens")).isEqualTo(4);
    }

    @Test
    void shouldKeepNullFieldsInMessageStartFrame() {
        String frame = ClaudeController.formatEvent(new StreamEvent.MessageStart("msg_1", "claude-sonnet-4-5", ClaudeUsage.EMPTY));

        assertThat(frame).contains("\"stop_reason\":null").contains("\"stop_sequence\":null");
    }

    @Test
    void shouldMapMalformedUpstreamBodyToBadGateway() {
        for (String body : new String[]{
                "{\"choices\":[null]}",
                "{\"choices\":[{\"message\":{\"tool_calls\":[null]}}]}",
                "{\"choices\":[{\"index\":\"x\"}]}",
                "{\"id\":\"no-choices\"}",
                "not json",
                ""}) {
            assertThatThrownBy(() -> ClaudeController.parseResponse(body))
                    .as(body)
                    .isInstanceOf(UpstreamException.class)
                    .satisfies(e -> assertThat(((UpstreamException) e).getStatusCode()).isEqualTo(502));
        }
    }

    @Test
    void shouldParseWellFormedUpstreamBody() {
        ChatCompletionResponse response = ClaudeController.parseResponse("""
                {"id":"c1","model":"gpt-4o","choices":[{"index":0,"message":{"role":"assistant","content":"ok"},"finish_reason":"stop"}]}
                """);

        assertThat(response.choices()).hasSize(1);
        assertThat(response.choices().get(0).content()).isEqualTo("ok");
    }

    private ClaudeStreamTranslator translator() {
        return new ClaudeStreamTranslator(renamer, "claude-sonnet-4.5", false);
    }
}
