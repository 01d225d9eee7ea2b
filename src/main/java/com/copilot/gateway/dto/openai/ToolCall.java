package com.copilot.gateway.dto.openai;

import com.alibaba.fastjson2.JSONObject;

/**
 * assistant 消息中的完整工具调用
 *
 * @param arguments JSON 编码的参数字符串
 */
public record ToolCall(String id, String name, String arguments) {

    public JSONObject toJson() {
        return JSONObject.of(
                "id", id, //
                "type", "function", //
                "function", JSONObject.of("name", name, "arguments", arguments) //
        );
    }

    static ToolCall parse(JSONObject json) {
        JSONObject function = json.getJSONObject("function");
        String name = function != null ? function.getString("name") : null;
        String arguments = function != null ? function.getString("arguments") : null;
        return new ToolCall(json.getString("id"), name, arguments);
    }
}
