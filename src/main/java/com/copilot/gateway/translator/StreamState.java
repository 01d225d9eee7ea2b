package com.copilot.gateway.translator;

import java.util.HashMap;
import java.util.Map;

/**
 * 单个流式连接的转换状态
 * <p>
 * 同一时刻最多一个打开的内容块，块索引只增不减；只由所属连接按事件顺序修改
 */
public class StreamState {

    public enum BlockKind {
        TEXT,
        THINKING,
        TOOL_USE
    }

    /**
     * 当前打开的内容块
     */
    public record OpenBlock(int index, BlockKind kind) {}

    /**
     * 工具调用累积器，按上游工具调用槽位记录
     */
    public static class ToolCallAccumulator {
        private final String id;
        private final String name;
        private final int blockIndex;
        private final StringBuilder arguments = new StringBuilder();

        ToolCallAccumulator(String id, String name, int blockIndex) {
            this.id = id;
            this.name = name;
            this.blockIndex = blockIndex;
        }

        public String id() {
            return id;
        }

        public String name() {
            return name;
        }

        public int blockIndex() {
            return blockIndex;
        }

        public String arguments() {
            return arguments.toString();
        }

        void append(String fragment) {
            arguments.append(fragment);
        }
    }

    private boolean messageStarted = false;
    private OpenBlock openBlock;
    private int nextIndex = 0;
    private final Map<Integer, ToolCallAccumulator> toolCalls = new HashMap<>();
    private boolean finished = false;

    public boolean isMessageStarted() {
        return messageStarted;
    }

    void markMessageStarted() {
        messageStarted = true;
    }

    public OpenBlock getOpenBlock() {
        return openBlock;
    }

    public boolean isOpen(BlockKind kind) {
        return openBlock != null && openBlock.kind() == kind;
    }

    /**
     * 打开新块，调用前必须已关闭上一个块
     *
     * @return 新块索引
     */
    int open(BlockKind kind) {
        if (openBlock != null) {
            throw new IllegalStateException("content block " + openBlock.index() + " is still open");
        }
        openBlock = new OpenBlock(nextIndex++, kind);
        return openBlock.index();
    }

    /**
     * 关闭当前块
     *
     * @return 被关闭块的索引
     */
    int close() {
        if (openBlock == null) {
            throw new IllegalStateException("no open content block");
        }
        int index = openBlock.index();
        openBlock = null;
        return index;
    }

    public int getNextIndex() {
        return nextIndex;
    }

    public Map<Integer, ToolCallAccumulator> getToolCalls() {
        return toolCalls;
    }

    ToolCallAccumulator startToolCall(int slot, String id, String name, int blockIndex) {
        ToolCallAccumulator accumulator = new ToolCallAccumulator(id, name, blockIndex);
        toolCalls.put(slot, accumulator);
        return accumulator;
    }

    public boolean isFinished() {
        return finished;
    }

    void markFinished() {
        finished = true;
    }
}
