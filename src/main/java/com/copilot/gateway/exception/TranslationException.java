package com.copilot.gateway.exception;

import lombok.Getter;

/**
 * 请求转换异常：客户端输入不合法或不受支持，消息中包含出错字段路径
 */
@Getter
public class TranslationException extends GatewayException {

    public enum Reason {
        INVALID_INPUT,
        UNSUPPORTED_TOOL_CHOICE
    }

    private final Reason reason;
    private final String field;

    public TranslationException(Reason reason, String field, String message) {
        super(field + ": " + message, 400);
        this.reason = reason;
        this.field = field;
    }

    public static TranslationException invalid(String field, String message) {
        return new TranslationException(Reason.INVALID_INPUT, field, message);
    }
}
