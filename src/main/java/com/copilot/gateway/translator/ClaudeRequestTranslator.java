package com.copilot.gateway.translator;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.config.AppProperties;
import com.copilot.gateway.dto.claude.ClaudeMessage;
import com.copilot.gateway.dto.claude.ClaudeRequest;
import com.copilot.gateway.dto.claude.ContentBlock;
import com.copilot.gateway.dto.claude.ToolChoice;
import com.copilot.gateway.dto.claude.ToolDefinition;
import com.copilot.gateway.dto.openai.ChatCompletionRequest;
import com.copilot.gateway.dto.openai.ChatMessage;
import com.copilot.gateway.dto.openai.ContentPart;
import com.copilot.gateway.dto.openai.FunctionTool;
import com.copilot.gateway.dto.openai.ToolCall;
import com.copilot.gateway.exception.TranslationException;
import com.copilot.gateway.model.ModelRenamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic 请求 → Copilot chat completions 请求
 */
@Component
public class ClaudeRequestTranslator {

    private static final Logger log = LoggerFactory.getLogger(ClaudeRequestTranslator.class);

    private final ModelRenamer renamer;
    private final AppProperties properties;

    public ClaudeRequestTranslator(ModelRenamer renamer, AppProperties properties) {
        this.renamer = renamer;
        this.properties = properties;
    }

    public ChatCompletionRequest translate(ClaudeRequest request) {
        boolean emulateThinking = properties.getThinking().isEmulate();
        List<ChatMessage> messages = new ArrayList<>();

        // 处理 system prompt
        String systemPrompt = String.join("\n\n", request.system());
        if (emulateThinking && request.thinkingEnabled()) {
            String thinkingPrompt = properties.getThinking().getPrompt();
            systemPrompt = systemPrompt.isEmpty() ? thinkingPrompt : systemPrompt + "\n\n" + thinkingPrompt;
        }
        if (!systemPrompt.isEmpty()) {
            messages.add(ChatMessage.system(systemPrompt));
        }

        List<ClaudeMessage> claudeMessages = request.messages();
        for (int i = 0; i < claudeMessages.size(); i++) {
            ClaudeMessage message = claudeMessages.get(i);
            String path = "messages[" + i + "].content";
            if (message.isUser()) {
                translateUserMessage(message.content(), path, messages);
            } else {
                messages.add(translateAssistantMessage(message.content(), path, emulateThinking));
            }
        }

        String backendModel = renamer.toBackend(request.model());
        if (!backendModel.equals(request.model())) {
            log.debug("模型名转换: {} → {}", request.model(), backendModel);
        }

        return new ChatCompletionRequest(
                backendModel,
                messages,
                request.maxTokens(),
                request.temperature(),
                request.topP(),
                request.stopSequences(),
                request.stream(),
                translateTools(request.tools()),
                translateToolChoice(request.toolChoice()),
                request.userId()
        );
    }

    // ==================== 消息转换 ====================

    /**
     * user 消息：每个 tool_result 拆成一条 tool 消息（放在前面），其余内容合成一条 user 消息
     */
    private void translateUserMessage(List<ContentBlock> blocks, String path, List<ChatMessage> out) {
        List<ContentBlock> others = new ArrayList<>();
        boolean hasToolResult = false;
        boolean hasImage = false;

        for (int i = 0; i < blocks.size(); i++) {
            ContentBlock block = blocks.get(i);
            if (block instanceof ContentBlock.ToolResult toolResult) {
                out.add(ChatMessage.tool(toolResult.toolUseId(), toolResult.content()));
                hasToolResult = true;
            } else if (block instanceof ContentBlock.Text || block instanceof ContentBlock.Image) {
                hasImage |= block instanceof ContentBlock.Image;
                others.add(block);
            } else {
                throw TranslationException.invalid(path + "[" + i + "].type",
                        "'" + block.type() + "' blocks are not allowed in user messages");
            }
        }

        if (others.isEmpty()) {
            if (!hasToolResult) {
                out.add(ChatMessage.user(""));
            }
            return;
        }

        if (hasImage) {
            List<ContentPart> parts = new ArrayList<>(others.size());
            for (ContentBlock block : others) {
                if (block instanceof ContentBlock.Text text) {
                    parts.add(new ContentPart.Text(text.text()));
                } else if (block instanceof ContentBlock.Image image) {
                    parts.add(new ContentPart.ImageUrl(image.toDataUrl()));
                }
            }
            out.add(ChatMessage.user(parts));
            return;
        }

        List<String> texts = new ArrayList<>(others.size());
        for (ContentBlock block : others) {
            texts.add(((ContentBlock.Text) block).text());
        }
        out.add(ChatMessage.user(String.join("\n\n", texts)));
    }

    /**
     * assistant 消息：文本与 thinking 合并为 content，tool_use 转为 tool_calls
     */
    private ChatMessage translateAssistantMessage(List<ContentBlock> blocks, String path, boolean emulateThinking) {
        List<String> texts = new ArrayList<>();
        List<ToolCall> toolCalls = new ArrayList<>();

        for (int i = 0; i < blocks.size(); i++) {
            ContentBlock block = blocks.get(i);
            if (block instanceof ContentBlock.Text text) {
                if (!text.text().isEmpty()) {
                    texts.add(text.text());
                }
            } else if (block instanceof ContentBlock.Thinking thinking) {
                if (!thinking.thinking().isEmpty()) {
                    texts.add(emulateThinking ? "<thinking>" + thinking.thinking() + "</thinking>" : thinking.thinking());
                }
            } else if (block instanceof ContentBlock.ToolUse toolUse) {
                toolCalls.add(new ToolCall(toolUse.id(), toolUse.name(), JSON.toJSONString(toolUse.input())));
            } else {
                throw TranslationException.invalid(path + "[" + i + "].type",
                        "'" + block.type() + "' blocks are not allowed in assistant messages");
            }
        }

        String content = texts.isEmpty() ? null : String.join("\n\n", texts);
        return ChatMessage.assistant(content, toolCalls);
    }

    // ==================== 工具转换 ====================

    private List<FunctionTool> translateTools(List<ToolDefinition> tools) {
        List<FunctionTool> result = new ArrayList<>(tools.size());
        for (ToolDefinition tool : tools) {
            // 服务端工具没有 input_schema，Copilot 无法执行
            if (!tool.hasSchema()) {
                log.debug("跳过无 input_schema 的工具: {}", tool.name());
                continue;
            }
            result.add(new FunctionTool(tool.name(), tool.description(), tool.inputSchema()));
        }
        return result;
    }

    private Object translateToolChoice(ToolChoice toolChoice) {
        if (toolChoice == null) {
            return null;
        }
        if (toolChoice instanceof ToolChoice.Auto) {
            return "auto";
        }
        if (toolChoice instanceof ToolChoice.Any) {
            return "required";
        }
        if (toolChoice instanceof ToolChoice.None) {
            return "none";
        }
        if (toolChoice instanceof ToolChoice.Tool tool) {
            return JSONObject.of("type", "function", "function", JSONObject.of("name", tool.name()));
        }
        throw new TranslationException(TranslationException.Reason.UNSUPPORTED_TOOL_CHOICE, "tool_choice",
                "unsupported tool_choice " + toolChoice);
    }
}
