package com.copilot.gateway.dto.openai;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * 发往 Copilot /chat/completions 的请求
 *
 * @param toolChoice "auto" / "required" / "none" 字符串，或 {"type":"function","function":{"name":...}}
 */
public record ChatCompletionRequest(
        String model,
        List<ChatMessage> messages,
        Integer maxTokens,
        Double temperature,
        Double topP,
        List<String> stop,
        boolean stream,
        List<FunctionTool> tools,
        Object toolChoice,
        String user
) {

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("model", model);

        JSONArray messageArray = new JSONArray(messages.size());
        for (ChatMessage message : messages) {
            messageArray.add(message.toJson());
        }
        json.put("messages", messageArray);

        if (maxTokens != null) {
            json.put("max_tokens", maxTokens);
        }
        if (temperature != null) {
            json.put("temperature", temperature);
        }
        if (topP != null) {
            json.put("top_p", topP);
        }
        if (stop != null && !stop.isEmpty()) {
            json.put("stop", stop.size() == 1 ? stop.get(0) : stop);
        }
        if (stream) {
            json.put("stream", true);
            // 让上游在流末尾附带 usage
            json.put("stream_options", JSONObject.of("include_usage", true));
        }
        if (tools != null && !tools.isEmpty()) {
            JSONArray toolArray = new JSONArray(tools.size());
            for (FunctionTool tool : tools) {
                toolArray.add(tool.toJson());
            }
            json.put("tools", toolArray);
        }
        if (toolChoice != null) {
            json.put("tool_choice", toolChoice);
        }
        if (user != null) {
            json.put("user", user);
        }
        return json;
    }
}
