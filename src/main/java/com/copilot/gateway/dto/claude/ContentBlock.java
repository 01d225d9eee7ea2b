package com.copilot.gateway.dto.claude;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.exception.TranslationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic 内容块（按 type 区分的联合类型）
 * <p>
 * 块在消息中的顺序有意义，解析和输出都保持原顺序
 */
public sealed interface ContentBlock
        permits ContentBlock.Text, ContentBlock.Image, ContentBlock.ToolUse, ContentBlock.ToolResult, ContentBlock.Thinking {

    String type();

    JSONObject toJson();

    record Text(String text) implements ContentBlock {
        @Override
        public String type() {
            return "text";
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", "text", "text", text);
        }
    }

    /**
     * 图片块，source 为 base64 时 url 为空，为 url 时 mediaType/data 为空
     */
    record Image(String mediaType, String data, String url) implements ContentBlock {
        @Override
        public String type() {
            return "image";
        }

        public String toDataUrl() {
            if (url != null) {
                return url;
            }
            return "data:" + mediaType + ";base64," + data;
        }

        @Override
        public JSONObject toJson() {
            JSONObject source = url != null
                    ? JSONObject.of("type", "url", "url", url)
                    : JSONObject.of("type", "base64", "media_type", mediaType, "data", data);
            return JSONObject.of("type", "image", "source", source);
        }
    }

    record ToolUse(String id, String name, JSONObject input) implements ContentBlock {
        @Override
        public String type() {
            return "tool_use";
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", "tool_use", "id", id, "name", name, "input", input);
        }
    }

    /**
     * 工具结果块，content 只保留其中的文本部分
     */
    record ToolResult(String toolUseId, String content, boolean isError) implements ContentBlock {
        @Override
        public String type() {
            return "tool_result";
        }

        @Override
        public JSONObject toJson() {
            JSONObject json = JSONObject.of("type", "tool_result", "tool_use_id", toolUseId, "content", content);
            if (isError) {
                json.put("is_error", true);
            }
            return json;
        }
    }

    record Thinking(String thinking, String signature) implements ContentBlock {
        @Override
        public String type() {
            return "thinking";
        }

        @Override
        public JSONObject toJson() {
            return JSONObject.of("type", "thinking", "thinking", thinking, "signature", signature == null ? "" : signature);
        }
    }

    // ==================== 解析 ====================

    /**
     * 解析单个内容块
     *
     * @param json 块 JSON
     * @param path 字段路径，用于错误信息，如 messages[0].content[1]
     */
    static ContentBlock parse(Object json, String path) {
        if (!(json instanceof JSONObject block)) {
            throw TranslationException.invalid(path, "content block must be an object");
        }
        String type = block.getString("type");
        if (type == null) {
            throw TranslationException.invalid(path + ".type", "missing content block type");
        }
        return switch (type) {
            case "text" -> new Text(requireString(block, "text", path));
            case "image" -> parseImage(block, path);
            case "tool_use" -> {
                JSONObject input = block.getJSONObject("input");
                yield new ToolUse(
                        requireString(block, "id", path),
                        requireString(block, "name", path),
                        input != null ? input : new JSONObject());
            }
            case "tool_result" -> new ToolResult(
                    requireString(block, "tool_use_id", path),
                    parseToolResultContent(block.get("content"), path + ".content"),
                    block.getBooleanValue("is_error"));
            case "thinking" -> new Thinking(
                    requireString(block, "thinking", path),
                    block.getString("signature"));
            default -> throw TranslationException.invalid(path + ".type", "unknown content block type '" + type + "'");
        };
    }

    /**
     * 解析内容：字符串视为单个文本块，数组逐个解析
     */
    static List<ContentBlock> parseContent(Object content, String path) {
        if (content instanceof String text) {
            return List.of(new Text(text));
        }
        if (content instanceof JSONArray array) {
            List<ContentBlock> blocks = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                blocks.add(parse(array.get(i), path + "[" + i + "]"));
            }
            return blocks;
        }
        throw TranslationException.invalid(path, "content must be a string or an array of content blocks");
    }

    private static Image parseImage(JSONObject block, String path) {
        JSONObject source = block.getJSONObject("source");
        if (source == null) {
            throw TranslationException.invalid(path + ".source", "missing image source");
        }
        String sourcePath = path + ".source";
        if ("url".equals(source.getString("type"))) {
            return new Image(null, null, requireString(source, "url", sourcePath));
        }
        return new Image(
                requireString(source, "media_type", sourcePath),
                requireString(source, "data", sourcePath),
                null);
    }

    private static String parseToolResultContent(Object content, String path) {
        if (content == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (ContentBlock block : parseContent(content, path)) {
            if (block instanceof Text text) {
                if (sb.length() > 0) {
                    sb.append("\n\n");
                }
                sb.append(text.text());
            }
        }
        return sb.toString();
    }

    private static String requireString(JSONObject json, String field, String path) {
        Object value = json.get(field);
        if (!(value instanceof String s)) {
            throw TranslationException.invalid(path + "." + field, value == null ? "missing required field" : "must be a string");
        }
        return s;
    }
}
