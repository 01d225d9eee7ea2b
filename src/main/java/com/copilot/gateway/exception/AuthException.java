package com.copilot.gateway.exception;

import lombok.Getter;

/**
 * 认证异常（缺少 token、token 交换失败、凭证过期）
 */
@Getter
public class AuthException extends GatewayException {

    public enum Reason {
        MISSING_TOKEN(403),
        EXCHANGE_FAILED(401),
        EXPIRED(401);

        private final int statusCode;

        Reason(int statusCode) {
            this.statusCode = statusCode;
        }
    }

    private final Reason reason;

    public AuthException(Reason reason, String message) {
        super(message, reason.statusCode);
        this.reason = reason;
    }

    public AuthException(Reason reason, String message, Throwable cause) {
        super(message, reason.statusCode, cause);
        this.reason = reason;
    }

    public static AuthException missingToken() {
        return new AuthException(Reason.MISSING_TOKEN,
                "no GitHub token provided: set GH_TOKEN or pass a token via x-api-key / Authorization header");
    }
}
