package com.copilot.gateway.dto.openai;

import com.alibaba.fastjson2.JSONObject;

/**
 * function 类型工具定义
 */
public record FunctionTool(String name, String description, JSONObject parameters) {

    public JSONObject toJson() {
        JSONObject function = JSONObject.of("name", name, "parameters", parameters);
        if (description != null) {
            function.put("description", description);
        }
        return JSONObject.of("type", "function", "function", function);
    }
}
