package com.copilot.gateway.dto.openai;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Copilot 流式响应的单个 chunk
 */
public record ChatCompletionChunk(String id, String model, List<ChunkChoice> choices, OpenAiUsage usage) {

    public record ChunkChoice(int index, String content, String reasoning, List<ToolCallDelta> toolCalls, String finishReason) {}

    /**
     * 工具调用增量；首个片段带 id 和 name，后续片段只带 arguments
     *
     * @param index 上游的工具调用槽位
     */
    public record ToolCallDelta(int index, String id, String name, String arguments) {}

    /**
     * 解析 chunk，choices 缺失时视为空列表（Copilot 末尾的 usage chunk 没有 choices）
     *
     * @throws IllegalArgumentException choices 或 tool_calls 中出现非对象元素
     */
    public static ChatCompletionChunk parse(JSONObject json) {
        List<ChunkChoice> choices = new ArrayList<>();
        JSONArray choiceArray = json.getJSONArray("choices");
        if (choiceArray != null) {
            for (int i = 0; i < choiceArray.size(); i++) {
                if (!(choiceArray.get(i) instanceof JSONObject choice)) {
                    throw new IllegalArgumentException("choices[" + i + "] is not an object");
                }
                choices.add(parseChoice(choice, i));
            }
        }
        return new ChatCompletionChunk(
                json.getString("id"),
                json.getString("model"),
                choices,
                OpenAiUsage.parse(json.getJSONObject("usage")));
    }

    private static ChunkChoice parseChoice(JSONObject choice, int position) {
        JSONObject delta = choice.getJSONObject("delta");
        String content = null;
        String reasoning = null;
        List<ToolCallDelta> toolCalls = List.of();
        if (delta != null) {
            content = delta.getString("content");
            reasoning = delta.getString("reasoning_text");
            if (reasoning == null) {
                reasoning = delta.getString("reasoning_content");
            }
            JSONArray callArray = delta.getJSONArray("tool_calls");
            if (callArray != null) {
                toolCalls = new ArrayList<>(callArray.size());
                for (int i = 0; i < callArray.size(); i++) {
                    if (!(callArray.get(i) instanceof JSONObject call)) {
                        throw new IllegalArgumentException("tool_calls[" + i + "] is not an object");
                    }
                    JSONObject function = call.getJSONObject("function");
                    toolCalls.add(new ToolCallDelta(
                            call.getIntValue("index", i),
                            call.getString("id"),
                            function != null ? function.getString("name") : null,
                            function != null ? function.getString("arguments") : null));
                }
            }
        }
        return new ChunkChoice(choice.getIntValue("index", position), content, reasoning, toolCalls, choice.getString("finish_reason"));
    }
}
