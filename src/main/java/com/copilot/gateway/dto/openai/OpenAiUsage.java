package com.copilot.gateway.dto.openai;

import com.alibaba.fastjson2.JSONObject;

/**
 * OpenAI usage，cachedTokens 来自 prompt_tokens_details.cached_tokens
 */
public record OpenAiUsage(long promptTokens, long completionTokens, long cachedTokens) {

    static OpenAiUsage parse(JSONObject json) {
        if (json == null) {
            return null;
        }
        JSONObject details = json.getJSONObject("prompt_tokens_details");
        long cached = details != null ? details.getLongValue("cached_tokens") : 0;
        return new OpenAiUsage(json.getLongValue("prompt_tokens"), json.getLongValue("completion_tokens"), cached);
    }
}
