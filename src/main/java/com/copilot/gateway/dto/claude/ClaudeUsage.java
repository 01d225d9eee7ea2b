package com.copilot.gateway.dto.claude;

import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.dto.openai.OpenAiUsage;

/**
 * Anthropic usage
 * <p>
 * inputTokens 不含缓存命中部分，缓存命中单独放在 cacheReadInputTokens
 */
public record ClaudeUsage(long inputTokens, long outputTokens, long cacheReadInputTokens) {

    public static final ClaudeUsage EMPTY = new ClaudeUsage(0, 0, 0);

    public static ClaudeUsage from(OpenAiUsage usage) {
        if (usage == null) {
            return EMPTY;
        }
        long cached = usage.cachedTokens();
        return new ClaudeUsage(Math.max(0, usage.promptTokens() - cached), usage.completionTokens(), cached);
    }

    public JSONObject toJson() {
        JSONObject json = JSONObject.of("input_tokens", inputTokens, "output_tokens", outputTokens);
        if (cacheReadInputTokens > 0) {
            json.put("cache_read_input_tokens", cacheReadInputTokens);
        }
        return json;
    }
}
