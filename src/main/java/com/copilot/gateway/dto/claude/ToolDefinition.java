package com.copilot.gateway.dto.claude;

import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.exception.TranslationException;

/**
 * 客户端声明的工具
 *
 * @param inputSchema 服务端工具（如 web_search）没有 schema，此时为 null
 */
public record ToolDefinition(String name, String description, JSONObject inputSchema) {

    public boolean hasSchema() {
        return inputSchema != null;
    }

    public static ToolDefinition parse(Object json, String path) {
        if (!(json instanceof JSONObject tool)) {
            throw TranslationException.invalid(path, "tool must be an object");
        }
        String name = tool.getString("name");
        if (name == null || name.isEmpty()) {
            throw TranslationException.invalid(path + ".name", "missing required field");
        }
        return new ToolDefinition(name, tool.getString("description"), tool.getJSONObject("input_schema"));
    }
}
