package com.copilot.gateway.translator;

import java.util.ArrayList;
import java.util.List;

/**
 * Thinking 标签解析器
 * <p>
 * 从文本中切分出 &lt;thinking&gt;...&lt;/thinking&gt; 内容和正文内容，按出现顺序输出。
 * 流式使用时逐段 {@link #feed}，结束时 {@link #finish}；非线程安全
 */
public class ThinkingParser {

    private static final String OPEN_TAG = "<thinking>";
    private static final String CLOSE_TAG = "</thinking>";

    private boolean inThinking = false;
    private final StringBuilder pendingBuffer = new StringBuilder();

    /**
     * 输入流式文本片段
     * <p>
     * 末尾可能是半个标签的部分暂存，等下一个片段到达后再判断
     *
     * @return 本次可以确定的片段，相邻同类片段已合并
     */
    public List<Segment> feed(String text) {
        List<Segment> segments = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return segments;
        }

        pendingBuffer.append(text);
        String pending = pendingBuffer.toString();
        pendingBuffer.setLength(0);

        while (!pending.isEmpty()) {
            String tag = inThinking ? CLOSE_TAG : OPEN_TAG;
            int tagStart = indexOfIgnoreCase(pending, tag);
            if (tagStart >= 0) {
                append(segments, inThinking, pending.substring(0, tagStart));
                inThinking = !inThinking;
                pending = pending.substring(tagStart + tag.length());
            } else {
                int safeEnd = findSafeEnd(pending, tag);
                append(segments, inThinking, pending.substring(0, safeEnd));
                pendingBuffer.append(pending, safeEnd, pending.length());
                pending = "";
            }
        }
        return segments;
    }

    /**
     * 完成解析，flush 暂存内容
     */
    public List<Segment> finish() {
        List<Segment> segments = new ArrayList<>();
        append(segments, inThinking, pendingBuffer.toString());
        pendingBuffer.setLength(0);
        return segments;
    }

    public boolean isInThinking() {
        return inThinking;
    }

    /**
     * 一次性切分完整文本（非流式响应）
     * <p>
     * 与流式 {@link #feed}/{@link #finish} 结果一致：标签不区分大小写，未闭合的 thinking 延续到文本末尾。
     * 没有 thinking 内容时原样返回一个正文片段；有 thinking 内容时丢弃只含空白的正文片段
     */
    public static List<Segment> split(String text) {
        ThinkingParser parser = new ThinkingParser();
        List<Segment> segments = parser.feed(text);
        for (Segment segment : parser.finish()) {
            append(segments, segment.thinking(), segment.text());
        }

        if (segments.stream().noneMatch(Segment::thinking)) {
            return List.of(new Segment(false, text));
        }
        segments.removeIf(segment -> !segment.thinking() && segment.text().isBlank());
        return segments;
    }

    // ==================== 辅助方法 ====================

    private static void append(List<Segment> segments, boolean thinking, String text) {
        if (text.isEmpty()) {
            return;
        }
        if (!segments.isEmpty()) {
            Segment last = segments.get(segments.size() - 1);
            if (last.thinking() == thinking) {
                segments.set(segments.size() - 1, new Segment(thinking, last.text() + text));
                return;
            }
        }
        segments.add(new Segment(thinking, text));
    }

    private static int indexOfIgnoreCase(String text, String tag) {
        for (int i = 0; i + tag.length() <= text.length(); i++) {
            if (text.regionMatches(true, i, tag, 0, tag.length())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 查找安全截断位置，避免截断可能的标签前缀
     */
    private static int findSafeEnd(String text, String tag) {
        // 检查 text 末尾是否与 tag 的前缀匹配
        for (int suffixLen = Math.min(text.length(), tag.length() - 1); suffixLen >= 1; suffixLen--) {
            String suffix = text.substring(text.length() - suffixLen);
            if (tag.substring(0, suffixLen).equalsIgnoreCase(suffix)) {
                return text.length() - suffixLen;
            }
        }
        return text.length();
    }

    /**
     * 解析片段
     *
     * @param thinking true 为 thinking 内容，false 为正文
     */
    public record Segment(boolean thinking, String text) {}
}
