package com.copilot.gateway.dto.claude;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

/**
 * Anthropic SSE 事件
 * <p>
 * 输出格式：event: {eventType}\ndata: {toJson}\n\n
 */
public sealed interface StreamEvent permits StreamEvent.MessageStart, StreamEvent.ContentBlockStart,
        StreamEvent.ContentBlockDelta, StreamEvent.ContentBlockStop, StreamEvent.MessageDelta,
        StreamEvent.MessageStop, StreamEvent.Error {

    String eventType();

    JSONObject toJson();

    record MessageStart(String id, String model, ClaudeUsage usage) implements StreamEvent {
        @Override
        public String eventType() {
            return "message_start";
        }

        @Override
        public JSONObject toJson() {
            JSONObject message = new JSONObject();
            message.put("id", id);
            message.put("type", "message");
            message.put("role", "assistant");
            message.put("content", new JSONArray());
            message.put("model", model);
            message.put("stop_reason", null);
            message.put("stop_sequence", null);
            message.put("usage", usage.toJson());
            return JSONObject.of("type", eventType(), "message", message);
        }
    }

    record ContentBlockStart(int index, ContentBlock contentBlock) implements StreamEvent {
        @Override
        public String eventType() {
            return "content_block_start";
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", eventType(), "index", index, "content_block", contentBlock.toJson());
        }
    }

    record ContentBlockDelta(int index, Delta delta) implements StreamEvent {
        @Override
        public String eventType() {
            return "content_block_delta";
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", eventType(), "index", index, "delta", delta.toJson());
        }
    }

    record ContentBlockStop(int index) implements StreamEvent {
        @Override
        public String eventType() {
            return "content_block_stop";
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", eventType(), "index", index);
        }
    }

    record MessageDelta(StopReason stopReason, ClaudeUsage usage) implements StreamEvent {
        @Override
        public String eventType() {
            return "message_delta";
        }

        @Override
        public JSONObject toJson() {
            JSONObject delta = new JSONObject();
            delta.put("stop_reason", stopReason.wireValue());
            delta.put("stop_sequence", null);
            return JSONObject.of("type", eventType(), "delta", delta, "usage", usage.toJson());
        }
    }

    record MessageStop() implements StreamEvent {
        @Override
        public String eventType() {
            return "message_stop";
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", eventType());
        }
    }

    record Error(String errorType, String message) implements StreamEvent {
        @Override
        public String eventType() {
            return "error";
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", eventType(), "error", JSONObject.of("type", errorType, "message", message));
        }
    }
}
