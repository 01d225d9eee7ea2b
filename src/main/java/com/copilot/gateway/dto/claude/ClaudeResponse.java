package com.copilot.gateway.dto.claude;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * Anthropic 非流式响应
 */
public record ClaudeResponse(String id, String model, List<ContentBlock> content, StopReason stopReason, ClaudeUsage usage) {

    public JSONObject toJson() {
        JSONArray blocks = new JSONArray(content.size());
        for (ContentBlock block : content) {
            blocks.add(block.toJson());
        }
        JSONObject json = new JSONObject();
        json.put("id", id);
        json.put("type", "message");
        json.put("role", "assistant");
        json.put("model", model);
        json.put("content", blocks);
        json.put("stop_reason", stopReason.wireValue());
        json.put("stop_sequence", null);
        json.put("usage", usage.toJson());
        return json;
    }
}
