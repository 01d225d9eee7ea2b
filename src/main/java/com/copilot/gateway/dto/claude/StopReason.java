package com.copilot.gateway.dto.claude;

/**
 * 停止原因
 * <p>
 * OTHER 表示上游给出了无法识别的 finish_reason，对外输出为 end_turn
 */
public enum StopReason {
    END_TURN("end_turn"),
    MAX_TOKENS("max_tokens"),
    TOOL_USE("tool_use"),
    REFUSAL("refusal"),
    OTHER("end_turn");

    private final String wireValue;

    StopReason(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * 映射 OpenAI finish_reason
     */
    public static StopReason fromFinishReason(String finishReason) {
        if (finishReason == null) {
            return END_TURN;
        }
        return switch (finishReason) {
            case "stop" -> END_TURN;
            case "length" -> MAX_TOKENS;
            case "tool_calls", "function_call" -> TOOL_USE;
            case "content_filter" -> REFUSAL;
            default -> OTHER;
        };
    }
}
