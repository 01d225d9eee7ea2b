package com.copilot.gateway.proxy;

/**
 * 上游 SSE 行解析器
 * <p>
 * 逐行输入，遇到空行时返回该事件的 data（多行 data 以换行连接），注释行和其他字段忽略。
 * 非线程安全，每个连接一个实例
 */
public class SseLineParser {

    public static final String DONE = "[DONE]";

    private final StringBuilder data = new StringBuilder();
    private boolean hasData = false;

    /**
     * 输入一行（不含行尾换行符）
     *
     * @return 事件结束时返回 data，否则返回 null
     */
    public String feed(String line) {
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        if (line.isEmpty()) {
            return flush();
        }
        if (line.startsWith(":")) {
            return null;
        }
        if (line.startsWith("data:")) {
            String value = line.substring(5);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            if (hasData) {
                data.append('\n');
            }
            data.append(value);
            hasData = true;
        }
        return null;
    }

    /**
     * 输出未以空行结束的最后一个事件
     */
    public String flush() {
        if (!hasData) {
            return null;
        }
        String result = data.toString();
        data.setLength(0);
        hasData = false;
        return result;
    }
}
