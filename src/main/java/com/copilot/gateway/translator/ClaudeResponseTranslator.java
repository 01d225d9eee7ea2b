package com.copilot.gateway.translator;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.config.AppProperties;
import com.copilot.gateway.dto.claude.ClaudeResponse;
import com.copilot.gateway.dto.claude.ClaudeUsage;
import com.copilot.gateway.dto.claude.ContentBlock;
import com.copilot.gateway.dto.claude.StopReason;
import com.copilot.gateway.dto.openai.ChatCompletionResponse;
import com.copilot.gateway.dto.openai.ToolCall;
import com.copilot.gateway.model.ModelRenamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Copilot 非流式响应 → Anthropic 响应
 * <p>
 * Copilot 有时把文本和工具调用拆在不同 choice 中，因此遍历全部 choice；文本块在工具块之前
 */
@Component
public class ClaudeResponseTranslator {

    private static final Logger log = LoggerFactory.getLogger(ClaudeResponseTranslator.class);

    private final ModelRenamer renamer;
    private final AppProperties properties;

    public ClaudeResponseTranslator(ModelRenamer renamer, AppProperties properties) {
        this.renamer = renamer;
        this.properties = properties;
    }

    /**
     * @param response          上游响应
     * @param fallbackModel     上游响应缺少 model 时使用的上游模型名
     * @param thinkingRequested 请求中启用了 thinking
     */
    public ClaudeResponse translate(ChatCompletionResponse response, String fallbackModel, boolean thinkingRequested) {
        boolean thinkingActive = properties.getThinking().isEmulate() && thinkingRequested;

        List<ContentBlock> thinkingBlocks = new ArrayList<>();
        List<ContentBlock> textBlocks = new ArrayList<>();
        List<ContentBlock> toolBlocks = new ArrayList<>();
        StopReason stopReason = StopReason.END_TURN;

        List<ChatCompletionResponse.Choice> choices = response.choices();
        for (int i = 0; i < choices.size(); i++) {
            ChatCompletionResponse.Choice choice = choices.get(i);

            if (thinkingActive && choice.reasoning() != null && !choice.reasoning().isEmpty()) {
                thinkingBlocks.add(new ContentBlock.Thinking(choice.reasoning(), newSignature()));
            }

            String content = choice.content();
            if (content != null && !content.isEmpty()) {
                if (thinkingActive) {
                    for (ThinkingParser.Segment segment : ThinkingParser.split(content)) {
                        textBlocks.add(segment.thinking()
                                ? new ContentBlock.Thinking(segment.text(), newSignature())
                                : new ContentBlock.Text(segment.text()));
                    }
                } else {
                    textBlocks.add(new ContentBlock.Text(content));
                }
            }

            for (ToolCall toolCall : choice.toolCalls()) {
                toolBlocks.add(translateToolCall(toolCall));
            }

            if (i == 0) {
                stopReason = StopReason.fromFinishReason(choice.finishReason());
            }
            if ("tool_calls".equals(choice.finishReason())) {
                stopReason = StopReason.TOOL_USE;
            }
        }

        List<ContentBlock> blocks = new ArrayList<>(thinkingBlocks.size() + textBlocks.size() + toolBlocks.size());
        blocks.addAll(thinkingBlocks);
        blocks.addAll(textBlocks);
        blocks.addAll(toolBlocks);

        String backendModel = response.model() != null ? response.model() : fallbackModel;
        String id = response.id() != null ? response.id() : "msg_" + UUID.randomUUID().toString().replace("-", "");
        return new ClaudeResponse(id, renamer.toClient(backendModel), blocks, stopReason, ClaudeUsage.from(response.usage()));
    }

    // ==================== 辅助方法 ====================

    /**
     * 参数解析失败时使用空对象，不影响整个响应
     */
    static ContentBlock.ToolUse translateToolCall(ToolCall toolCall) {
        JSONObject input = null;
        String arguments = toolCall.arguments();
        if (arguments != null && !arguments.isBlank()) {
            try {
                Object parsed = JSON.parse(arguments);
                if (parsed instanceof JSONObject object) {
                    input = object;
                } else {
                    log.debug("工具 {} 参数不是 JSON 对象: {}", toolCall.name(), arguments);
                }
            } catch (JSONException e) {
                log.debug("工具 {} 参数解析失败: {}", toolCall.name(), e.getMessage());
            }
        }
        String id = toolCall.id() != null ? toolCall.id() : "toolu_" + UUID.randomUUID().toString().replace("-", "");
        return new ContentBlock.ToolUse(id, toolCall.name(), input != null ? input : new JSONObject());
    }

    static String newSignature() {
        return "sig_" + UUID.randomUUID().toString().replace("-", "");
    }
}
