package com.copilot.gateway.dto.openai;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * OpenAI 对话消息
 * <p>
 * content 与 parts 二选一：纯文本时使用 content，含图片时使用 parts
 *
 * @param role       system / user / assistant / tool
 * @param toolCalls  仅 assistant 消息
 * @param toolCallId 仅 tool 消息
 */
public record ChatMessage(String role, String content, List<ContentPart> parts, List<ToolCall> toolCalls, String toolCallId) {

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content, null, null, null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content, null, null, null);
    }

    public static ChatMessage user(List<ContentPart> parts) {
        return new ChatMessage("user", null, parts, null, null);
    }

    public static ChatMessage assistant(String content, List<ToolCall> toolCalls) {
        return new ChatMessage("assistant", content, null, toolCalls == null || toolCalls.isEmpty() ? null : toolCalls, null);
    }

    public static ChatMessage tool(String toolCallId, String content) {
        return new ChatMessage("tool", content, null, null, toolCallId);
    }

    public JSONObject toJson() {
        JSONObject json = JSONObject.of("role", role);
        if (parts != null) {
            JSONArray array = new JSONArray(parts.size());
            for (ContentPart part : parts) {
                array.add(part.toJson());
            }
            json.put("content", array);
        } else if (content != null) {
            json.put("content", content);
        }
        if (toolCalls != null) {
            JSONArray array = new JSONArray(toolCalls.size());
            for (ToolCall call : toolCalls) {
                array.add(call.toJson());
            }
            json.put("tool_calls", array);
        }
        if (toolCallId != null) {
            json.put("tool_call_id", toolCallId);
        }
        return json;
    }
}
