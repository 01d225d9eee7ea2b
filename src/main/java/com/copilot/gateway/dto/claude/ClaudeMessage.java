package com.copilot.gateway.dto.claude;

import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.exception.TranslationException;

import java.util.List;

/**
 * Anthropic 对话消息
 *
 * @param role    user / assistant
 * @param content 有序内容块
 */
public record ClaudeMessage(String role, List<ContentBlock> content) {

    public boolean isUser() {
        return "user".equals(role);
    }

    public boolean isAssistant() {
        return "assistant".equals(role);
    }

    public static ClaudeMessage parse(Object json, String path) {
        if (!(json instanceof JSONObject message)) {
            throw TranslationException.invalid(path, "message must be an object");
        }
        String role = message.getString("role");
        if (role == null) {
            throw TranslationException.invalid(path + ".role", "missing required field");
        }
        if (!"user".equals(role) && !"assistant".equals(role)) {
            throw TranslationException.invalid(path + ".role", "unsupported role '" + role + "'");
        }
        Object content = message.get("content");
        if (content == null) {
            throw TranslationException.invalid(path + ".content", "missing required field");
        }
        return new ClaudeMessage(role, ContentBlock.parseContent(content, path + ".content"));
    }
}
