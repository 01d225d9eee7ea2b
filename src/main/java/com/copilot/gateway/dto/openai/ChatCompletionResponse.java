package com.copilot.gateway.dto.openai;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Copilot 非流式响应
 */
public record ChatCompletionResponse(String id, String model, List<Choice> choices, OpenAiUsage usage) {

    /**
     * @param reasoning 部分模型返回的 reasoning_text / reasoning_content
     */
    public record Choice(int index, String content, String reasoning, List<ToolCall> toolCalls, String finishReason) {}

    /**
     * 解析响应体
     *
     * @throws IllegalArgumentException 缺少 choices，或 choices / tool_calls 中出现非对象元素
     */
    public static ChatCompletionResponse parse(JSONObject json) {
        JSONArray choiceArray = json.getJSONArray("choices");
        if (choiceArray == null) {
            throw new IllegalArgumentException("missing choices");
        }
        List<Choice> choices = new ArrayList<>(choiceArray.size());
        for (int i = 0; i < choiceArray.size(); i++) {
            if (!(choiceArray.get(i) instanceof JSONObject choice)) {
                throw new IllegalArgumentException("choices[" + i + "] is not an object");
            }
            JSONObject message = choice.getJSONObject("message");
            if (message == null) {
                choices.add(new Choice(choice.getIntValue("index", i), null, null, List.of(), choice.getString("finish_reason")));
                continue;
            }
            List<ToolCall> toolCalls = new ArrayList<>();
            JSONArray callArray = message.getJSONArray("tool_calls");
            if (callArray != null) {
                for (int j = 0; j < callArray.size(); j++) {
                    if (!(callArray.get(j) instanceof JSONObject call)) {
                        throw new IllegalArgumentException("choices[" + i + "].message.tool_calls[" + j + "] is not an object");
                    }
                    toolCalls.add(ToolCall.parse(call));
                }
            }
            String reasoning = message.getString("reasoning_text");
            if (reasoning == null) {
                reasoning = message.getString("reasoning_content");
            }
            choices.add(new Choice(
                    choice.getIntValue("index", i),
                    message.getString("content"),
                    reasoning,
                    toolCalls,
                    choice.getString("finish_reason")));
        }
        return new ChatCompletionResponse(
                json.getString("id"),
                json.getString("model"),
                choices,
                OpenAiUsage.parse(json.getJSONObject("usage")));
    }
}
