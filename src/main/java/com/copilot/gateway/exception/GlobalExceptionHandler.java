package com.copilot.gateway.exception;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * 全局异常处理器
 * <p>
 * 所有错误统一输出 Anthropic 错误结构：{"type":"error","error":{"type":...,"message":...}}
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<String> handleAuth(AuthException e) {
        log.warn("认证失败: reason={}, {}", e.getReason(), e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "authentication_error", e.getMessage());
    }

    @ExceptionHandler(TranslationException.class)
    public ResponseEntity<String> handleTranslation(TranslationException e) {
        log.warn("请求转换失败: reason={}, {}", e.getReason(), e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "invalid_request_error", e.getMessage());
    }

    @ExceptionHandler(JSONException.class)
    public ResponseEntity<String> handleJson(JSONException e) {
        log.warn("请求体 JSON 解析失败: {}", e.getMessage());
        return buildErrorResponse(400, "invalid_request_error", "request body is not valid JSON: " + e.getMessage());
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<String> handleUpstream(UpstreamException e) {
        log.error("Copilot API 异常: status={}, body={}", e.getStatusCode(), e.getResponseBody());
        return buildErrorResponse(e.getStatusCode(), "api_error", e.getMessage());
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<String> handleGateway(GatewayException e) {
        log.error("网关异常: {}", e.getMessage(), e);
        return buildErrorResponse(e.getStatusCode(), "api_error", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        if (statusCode == 404) {
            log.warn("路由未找到: {}", e.getReason());
            return buildErrorResponse(statusCode, "not_found_error", e.getReason());
        }
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        return buildErrorResponse(statusCode, "invalid_request_error", e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, "internal_error", "服务器内部错误");
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, String errorType, String message) {
        JSONObject body = JSONObject.of(
                "type", "error", //
                "error", JSONObject.of( //
                        "type", errorType, //
                        "message", message //
                ) //
        );
        return ResponseEntity
                .status(statusCode)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body.toJSONString());
    }
}
