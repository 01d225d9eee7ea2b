package com.copilot.gateway.translator;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.dto.claude.ClaudeUsage;
import com.copilot.gateway.dto.claude.ContentBlock;
import com.copilot.gateway.dto.claude.Delta;
import com.copilot.gateway.dto.claude.StopReason;
import com.copilot.gateway.dto.claude.StreamEvent;
import com.copilot.gateway.dto.openai.ChatCompletionChunk;
import com.copilot.gateway.model.ModelRenamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Copilot 流式 chunk → Anthropic SSE 事件
 * <p>
 * 每个连接一个实例，按 chunk 到达顺序调用，非线程安全。
 * 保证：message_start 与 message_stop 各一次；同一时刻最多一个打开的内容块；块索引严格递增。
 * <p>
 * 收到 finish_reason 时立即关闭内容块，message_delta/message_stop 留到上游结束（{@link #finish}）再输出，
 * 以便带上 finish chunk 之后单独到达的 usage
 */
public class ClaudeStreamTranslator {

    private static final Logger log = LoggerFactory.getLogger(ClaudeStreamTranslator.class);

    private final ModelRenamer renamer;
    private final String fallbackModel;
    private final boolean thinkingActive;
    private final ThinkingParser thinkingParser;
    private final StreamState state = new StreamState();

    private ClaudeUsage usage = ClaudeUsage.EMPTY;
    // 已收到 finish_reason，之后只接收 usage
    private StopReason pendingStopReason;

    /**
     * @param renamer        模型名转换
     * @param fallbackModel  chunk 缺少 model 时使用的上游模型名
     * @param thinkingActive 开启 thinking 模拟且请求要求 thinking
     */
    public ClaudeStreamTranslator(ModelRenamer renamer, String fallbackModel, boolean thinkingActive) {
        this.renamer = renamer;
        this.fallbackModel = fallbackModel;
        this.thinkingActive = thinkingActive;
        this.thinkingParser = thinkingActive ? new ThinkingParser() : null;
    }

    /**
     * 转换一条上游 SSE data，无法解析或结构不符的 data 记录后跳过
     */
    public List<StreamEvent> translate(String data) {
        if (state.isFinished()) {
            return List.of();
        }
        ChatCompletionChunk chunk;
        try {
            Object parsed = JSON.parse(data);
            if (!(parsed instanceof JSONObject json)) {
                log.debug("跳过非对象 chunk: {}", data);
                return List.of();
            }
            chunk = ChatCompletionChunk.parse(json);
        } catch (RuntimeException e) {
            // 结构异常的 chunk 只跳过，不中断整个流
            log.warn("跳过无法解析的 chunk: {}, 原因: {}", data, e.toString());
            return List.of();
        }
        return translate(chunk);
    }

    public List<StreamEvent> translate(ChatCompletionChunk chunk) {
        if (state.isFinished()) {
            return List.of();
        }
        if (chunk.usage() != null) {
            usage = ClaudeUsage.from(chunk.usage());
        }
        if (pendingStopReason != null) {
            return List.of();
        }
        List<StreamEvent> events = new ArrayList<>();
        ensureMessageStarted(events, chunk.id(), chunk.model());

        String finishReason = null;
        for (ChatCompletionChunk.ChunkChoice choice : chunk.choices()) {
            if (thinkingActive) {
                appendThinking(events, choice.reasoning());
            }
            appendContent(events, choice.content());
            for (ChatCompletionChunk.ToolCallDelta toolCall : choice.toolCalls()) {
                appendToolCall(events, toolCall);
            }
            if (choice.finishReason() != null && (finishReason == null || "tool_calls".equals(choice.finishReason()))) {
                finishReason = choice.finishReason();
            }
        }

        if (finishReason != null) {
            closeContent(events);
            pendingStopReason = StopReason.fromFinishReason(finishReason);
        }
        return events;
    }

    /**
     * 上游流结束，输出 message_delta 与 message_stop
     * <p>
     * 没有收到过 finish_reason 时按 end_turn 结束
     */
    public List<StreamEvent> finish() {
        if (state.isFinished()) {
            return List.of();
        }
        List<StreamEvent> events = new ArrayList<>();
        ensureMessageStarted(events, null, null);
        if (pendingStopReason == null) {
            closeContent(events);
        }
        terminate(events, pendingStopReason != null ? pendingStopReason : StopReason.END_TURN);
        return events;
    }

    /**
     * 上游流中断，输出唯一的 error 事件后结束；内容已完整（收到过 finish_reason）时正常结束
     */
    public List<StreamEvent> fail(Throwable error) {
        if (state.isFinished()) {
            return List.of();
        }
        if (pendingStopReason != null) {
            log.warn("finish_reason 之后上游流中断，按正常结束处理: {}", error.getMessage());
            return finish();
        }
        state.markFinished();
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return List.of(new StreamEvent.Error("api_error", message));
    }

    public StreamState getState() {
        return state;
    }

    // ==================== 内容块 ====================

    private void appendContent(List<StreamEvent> events, String content) {
        if (content == null || content.isEmpty()) {
            return;
        }
        if (thinkingParser == null) {
            appendText(events, content);
            return;
        }
        appendSegments(events, thinkingParser.feed(content));
    }

    private void appendSegments(List<StreamEvent> events, List<ThinkingParser.Segment> segments) {
        for (ThinkingParser.Segment segment : segments) {
            if (segment.thinking()) {
                appendThinking(events, segment.text());
            } else {
                appendText(events, segment.text());
            }
        }
    }

    private void appendText(List<StreamEvent> events, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (!state.isOpen(StreamState.BlockKind.TEXT)) {
            // thinking 结束标签后的换行不单独开文本块
            if (thinkingParser != null && text.isBlank()) {
                return;
            }
            closeOpenBlock(events);
            int index = state.open(StreamState.BlockKind.TEXT);
            events.add(new StreamEvent.ContentBlockStart(index, new ContentBlock.Text("")));
        }
        events.add(new StreamEvent.ContentBlockDelta(state.getOpenBlock().index(), new Delta.Text(text)));
    }

    private void appendThinking(List<StreamEvent> events, String thinking) {
        if (thinking == null || thinking.isEmpty()) {
            return;
        }
        if (!state.isOpen(StreamState.BlockKind.THINKING)) {
            closeOpenBlock(events);
            int index = state.open(StreamState.BlockKind.THINKING);
            events.add(new StreamEvent.ContentBlockStart(index, new ContentBlock.Thinking("", "")));
        }
        events.add(new StreamEvent.ContentBlockDelta(state.getOpenBlock().index(), new Delta.Thinking(thinking)));
    }

    private void appendToolCall(List<StreamEvent> events, ChatCompletionChunk.ToolCallDelta delta) {
        int slot = delta.index();
        StreamState.ToolCallAccumulator accumulator = state.getToolCalls().get(slot);

        boolean fresh = delta.name() != null
                && (accumulator == null || (delta.id() != null && !delta.id().equals(accumulator.id())));
        if (fresh) {
            flushThinkingParser(events);
            closeOpenBlock(events);
            String id = delta.id() != null ? delta.id() : "toolu_" + UUID.randomUUID().toString().replace("-", "");
            int index = state.open(StreamState.BlockKind.TOOL_USE);
            accumulator = state.startToolCall(slot, id, delta.name(), index);
            events.add(new StreamEvent.ContentBlockStart(index, new ContentBlock.ToolUse(id, delta.name(), new JSONObject())));
        }

        String arguments = delta.arguments();
        if (arguments == null || arguments.isEmpty()) {
            return;
        }
        if (accumulator == null) {
            log.debug("跳过未知工具调用槽位 {} 的参数片段", slot);
            return;
        }
        accumulator.append(arguments);
        StreamState.OpenBlock open = state.getOpenBlock();
        // 块已关闭的槽位只累积不输出，索引不复用
        if (open != null && open.kind() == StreamState.BlockKind.TOOL_USE && open.index() == accumulator.blockIndex()) {
            events.add(new StreamEvent.ContentBlockDelta(open.index(), new Delta.InputJson(arguments)));
        }
    }

    // ==================== 辅助方法 ====================

    private void ensureMessageStarted(List<StreamEvent> events, String id, String model) {
        if (state.isMessageStarted()) {
            return;
        }
        state.markMessageStarted();
        String messageId = id != null ? id : "msg_" + UUID.randomUUID().toString().replace("-", "");
        String backendModel = model != null ? model : fallbackModel;
        events.add(new StreamEvent.MessageStart(messageId, renamer.toClient(backendModel), usage));
    }

    private void closeOpenBlock(List<StreamEvent> events) {
        StreamState.OpenBlock open = state.getOpenBlock();
        if (open == null) {
            return;
        }
        if (open.kind() == StreamState.BlockKind.THINKING) {
            events.add(new StreamEvent.ContentBlockDelta(open.index(), new Delta.Signature(ClaudeResponseTranslator.newSignature())));
        }
        events.add(new StreamEvent.ContentBlockStop(state.close()));
    }

    private void flushThinkingParser(List<StreamEvent> events) {
        if (thinkingParser != null) {
            appendSegments(events, thinkingParser.finish());
        }
    }

    private void closeContent(List<StreamEvent> events) {
        flushThinkingParser(events);
        closeOpenBlock(events);
    }

    private void terminate(List<StreamEvent> events, StopReason stopReason) {
        events.add(new StreamEvent.MessageDelta(stopReason, usage));
        events.add(new StreamEvent.MessageStop());
        state.markFinished();
        log.debug("流式响应结束: stop_reason={}, 内容块 {} 个", stopReason.wireValue(), state.getNextIndex());
    }
}
