package com.copilot.gateway.exception;

import lombok.Getter;

/**
 * Copilot API 调用异常
 */
@Getter
public class UpstreamException extends GatewayException {

    private final String responseBody;

    public UpstreamException(int statusCode, String responseBody) {
        super("Copilot API 错误: " + statusCode + " - " + responseBody, toClientStatus(statusCode));
        this.responseBody = responseBody;
    }

    public UpstreamException(String message, Throwable cause) {
        super("Copilot API 调用失败: " + message, 502, cause);
        this.responseBody = null;
    }

    public boolean isAuthError() {
        return getStatusCode() == 401 || getStatusCode() == 403;
    }

    // 只透传有意义的错误状态码，其余统一映射为 502
    private static int toClientStatus(int statusCode) {
        return statusCode >= 400 && statusCode <= 599 ? statusCode : 502;
    }
}
