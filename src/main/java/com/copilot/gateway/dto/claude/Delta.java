package com.copilot.gateway.dto.claude;

import com.alibaba.fastjson2.JSONObject;

/**
 * content_block_delta 中的增量
 */
public sealed interface Delta permits Delta.Text, Delta.InputJson, Delta.Thinking, Delta.Signature {

    JSONObject toJson();

    record Text(String text) implements Delta {
        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", "text_delta", "text", text);
        }
    }

    record InputJson(String partialJson) implements Delta {
        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", "input_json_delta", "partial_json", partialJson);
        }
    }

    record Thinking(String thinking) implements Delta {
        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", "thinking_delta", "thinking", thinking);
        }
    }

    record Signature(String signature) implements Delta {
        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", "signature_delta", "signature", signature);
        }
    }
}
