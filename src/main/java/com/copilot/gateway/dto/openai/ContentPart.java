package com.copilot.gateway.dto.openai;

import com.alibaba.fastjson2.JSONObject;

/**
 * 多模态 user 消息中的内容片段
 */
public sealed interface ContentPart permits ContentPart.Text, ContentPart.ImageUrl {

    JSONObject toJson();

    record Text(String text) implements ContentPart {
        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", "text", "text", text);
        }
    }

    record ImageUrl(String url) implements ContentPart {
        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", "image_url", "image_url", JSONObject.of("url", url));
        }
    }
}
