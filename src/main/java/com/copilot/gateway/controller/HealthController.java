package com.copilot.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.auth.AuthService;
import com.copilot.gateway.config.AppProperties;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查端点
 */
@RestController
public class HealthController {

    private final AuthService authService;
    private final AppProperties properties;

    public HealthController(AuthService authService, AppProperties properties) {
        this.authService = authService;
        this.properties = properties;
    }

    @GetMapping(value = {"/", "/health"}, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        boolean operatorMode = properties.hasGithubToken();
        JSONObject result = new JSONObject();
        // 运营方模式下 token 尚未交换成功视为降级
        result.put("status", !operatorMode || authService.hasOperatorToken() ? "ok" : "degraded");
        result.put("version", "1.0.0");
        result.put("mode", operatorMode ? "operator" : "caller");
        result.put("accountType", properties.getAccountType());
        result.put("cachedCallerTokens", authService.cachedCallerCount());
        return Mono.just(result.toJSONString());
    }
}
