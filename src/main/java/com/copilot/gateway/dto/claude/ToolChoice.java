package com.copilot.gateway.dto.claude;

import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.exception.TranslationException;

/**
 * 工具选择模式
 */
public sealed interface ToolChoice permits ToolChoice.Auto, ToolChoice.Any, ToolChoice.None, ToolChoice.Tool {

    record Auto() implements ToolChoice {}

    record Any() implements ToolChoice {}

    record None() implements ToolChoice {}

    record Tool(String name) implements ToolChoice {}

    static ToolChoice parse(Object json, String path) {
        String type;
        JSONObject choice = null;
        if (json instanceof String s) {
            type = s;
        } else if (json instanceof JSONObject obj) {
            choice = obj;
            type = obj.getString("type");
        } else {
            throw new TranslationException(TranslationException.Reason.UNSUPPORTED_TOOL_CHOICE, path,
                    "tool_choice must be an object");
        }
        if (type == null) {
            throw new TranslationException(TranslationException.Reason.UNSUPPORTED_TOOL_CHOICE, path + ".type",
                    "missing tool_choice type");
        }
        return switch (type) {
            case "auto" -> new Auto();
            case "any" -> new Any();
            case "none" -> new None();
            case "tool" -> {
                String name = choice != null ? choice.getString("name") : null;
                if (name == null || name.isEmpty()) {
                    throw TranslationException.invalid(path + ".name", "named tool_choice requires a tool name");
                }
                yield new Tool(name);
            }
            default -> throw new TranslationException(TranslationException.Reason.UNSUPPORTED_TOOL_CHOICE,
                    path + ".type", "unsupported tool_choice '" + type + "'");
        };
    }
}
