package com.copilot.gateway.dto.claude;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.exception.TranslationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic /v1/messages 请求
 *
 * @param system          系统提示文本段，未提供时为空列表
 * @param toolChoice      未提供时为 null
 * @param thinkingEnabled 请求体中 thinking.type == "enabled"
 */
public record ClaudeRequest(
        String model,
        List<ClaudeMessage> messages,
        List<String> system,
        Integer maxTokens,
        Double temperature,
        Double topP,
        List<String> stopSequences,
        boolean stream,
        List<ToolDefinition> tools,
        ToolChoice toolChoice,
        boolean thinkingEnabled,
        String userId
) {

    /**
     * 从请求 JSON 解析，结构不合法时抛出 {@link TranslationException}，消息中包含字段路径
     */
    public static ClaudeRequest parse(JSONObject body) {
        if (body == null) {
            throw TranslationException.invalid("body", "request body is empty");
        }

        Object model = body.get("model");
        if (!(model instanceof String modelName) || modelName.isEmpty()) {
            throw TranslationException.invalid("model", "missing required field");
        }

        Object rawMessages = body.get("messages");
        if (!(rawMessages instanceof JSONArray messageArray)) {
            throw TranslationException.invalid("messages", rawMessages == null ? "missing required field" : "must be an array");
        }
        List<ClaudeMessage> messages = new ArrayList<>(messageArray.size());
        for (int i = 0; i < messageArray.size(); i++) {
            messages.add(ClaudeMessage.parse(messageArray.get(i), "messages[" + i + "]"));
        }

        List<ToolDefinition> tools = new ArrayList<>();
        JSONArray toolArray = body.getJSONArray("tools");
        if (toolArray != null) {
            for (int i = 0; i < toolArray.size(); i++) {
                tools.add(ToolDefinition.parse(toolArray.get(i), "tools[" + i + "]"));
            }
        }

        Object rawToolChoice = body.get("tool_choice");
        ToolChoice toolChoice = rawToolChoice != null ? ToolChoice.parse(rawToolChoice, "tool_choice") : null;

        JSONObject thinking = body.getJSONObject("thinking");
        boolean thinkingEnabled = thinking != null && "enabled".equals(thinking.getString("type"));

        JSONObject metadata = body.getJSONObject("metadata");

        return new ClaudeRequest(
                modelName,
                messages,
                parseSystem(body.get("system")),
                body.getInteger("max_tokens"),
                body.getDouble("temperature"),
                body.getDouble("top_p"),
                parseStopSequences(body.getJSONArray("stop_sequences")),
                body.getBooleanValue("stream"),
                tools,
                toolChoice,
                thinkingEnabled,
                metadata != null ? metadata.getString("user_id") : null
        );
    }

    /**
     * 是否包含图片（决定 copilot-vision-request 头）
     */
    public boolean hasVisionContent() {
        for (ClaudeMessage message : messages) {
            for (ContentBlock block : message.content()) {
                if (block instanceof ContentBlock.Image) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * 对话中出现过 assistant 消息即视为 agent 发起的后续调用（决定 x-initiator 头）
     */
    public boolean isAgentCall() {
        for (ClaudeMessage message : messages) {
            if (message.isAssistant()) {
                return true;
            }
        }
        return false;
    }

    private static List<String> parseSystem(Object system) {
        if (system == null) {
            return List.of();
        }
        if (system instanceof String text) {
            return List.of(text);
        }
        if (system instanceof JSONArray array) {
            List<String> parts = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                ContentBlock block = ContentBlock.parse(array.get(i), "system[" + i + "]");
                if (!(block instanceof ContentBlock.Text text)) {
                    throw TranslationException.invalid("system[" + i + "].type", "system blocks must be text");
                }
                parts.add(text.text());
            }
            return parts;
        }
        throw TranslationException.invalid("system", "must be a string or an array of text blocks");
    }

    private static List<String> parseStopSequences(JSONArray array) {
        if (array == null || array.isEmpty()) {
            return List.of();
        }
        List<String> stops = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            stops.add(array.getString(i));
        }
        return stops;
    }
}
