package com.copilot.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiControllerTest {

    @Test
    void shouldDetectImageParts() {
        JSONObject request = JSONObject.parseObject("""
                {"messages": [
                  {"role": "user", "content": "plain"},
                  {"role": "user", "content": [
                    {"type": "text", "text": "look"},
                    {"type": "image_url", "image_url": {"url": "data:image/png;base64,AAAA"}}
                  ]}
                ]}
                """);

        assertThat(OpenAiController.hasImageContent(request)).isTrue();
        assertThat(OpenAiController.hasImageContent(JSONObject.parseObject("""
                {"messages": [{"role": "user", "content": [{"type": "text", "text": "no image"}]}]}
                """))).isFalse();
        assertThat(OpenAiController.hasImageContent(new JSONObject())).isFalse();
    }

    @Test
    void shouldTreatAssistantOrToolMessagesAsAgentCall() {
        assertThat(OpenAiController.isAgentCall(JSONObject.parseObject("""
                {"messages": [{"role": "system", "content": "s"}, {"role": "user", "content": "u"}]}
                """))).isFalse();
        assertThat(OpenAiController.isAgentCall(JSONObject.parseObject("""
                {"messages": [{"role": "user", "content": "u"}, {"role": "tool", "tool_call_id": "t", "content": "r"}]}
                """))).isTrue();
        assertThat(OpenAiController.isAgentCall(JSONObject.parseObject("""
                {"messages": [{"role": "assistant", "content": "a"}]}
                """))).isTrue();
    }
}
