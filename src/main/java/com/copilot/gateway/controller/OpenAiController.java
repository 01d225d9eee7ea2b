package com.copilot.gateway.controller;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.auth.AuthService;
import com.copilot.gateway.exception.TranslationException;
import com.copilot.gateway.model.ModelCatalog;
import com.copilot.gateway.model.ModelRenamer;
import com.copilot.gateway.proxy.CopilotApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * OpenAI 兼容 API 端点
 * <p>
 * POST /v1/chat/completions：透传，只转换模型名
 * GET  /v1/models：模型列表
 * <p>
 * 同时挂载不带 /v1 前缀的路径
 */
@RestController
public class OpenAiController {

    private static final Logger log = LoggerFactory.getLogger(OpenAiController.class);

    private final AuthService authService;
    private final CopilotApiClient copilotClient;
    private final ModelRenamer renamer;
    private final ModelCatalog catalog;

    public OpenAiController(AuthService authService, CopilotApiClient copilotClient,
                            ModelRenamer renamer, ModelCatalog catalog) {
        this.authService = authService;
        this.copilotClient = copilotClient;
        this.renamer = renamer;
        this.catalog = catalog;
    }

    /**
     * POST /v1/chat/completions
     */
    @PostMapping(value = {"/v1/chat/completions", "/chat/completions"})
    public Mono<Void> chatCompletions(@RequestBody String body, ServerWebExchange exchange) {
        JSONObject request = JSONObject.parseObject(body);
        if (request == null) {
            throw TranslationException.invalid("body", "request body is empty");
        }
        String requestedModel = request.getString("model");
        if (requestedModel != null) {
            request.put("model", renamer.toBackend(requestedModel));
        }
        String payload = request.toJSONString();
        boolean vision = hasImageContent(request);
        boolean agent = isAgentCall(request);
        String callerToken = CallerTokenFilter.getCallerToken(exchange);

        log.info("OpenAI 透传请求: model={} → {}, stream={}", requestedModel, request.getString("model"),
                request.getBooleanValue("stream", false));

        DataBufferFactory bufferFactory = exchange.getResponse().bufferFactory();

        return Mono.fromCallable(() -> copilotClient.chatCompletions(payload, authService.resolve(callerToken), vision, agent))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(upstream -> {
                    exchange.getResponse().setStatusCode(HttpStatusCode.valueOf(upstream.statusCode()));
                    if (upstream.isEventStream()) {
                        exchange.getResponse().getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
                        exchange.getResponse().getHeaders().setCacheControl("no-cache");
                        return exchange.getResponse().writeAndFlushWith(
                                CopilotApiClient.rawChunks(upstream)
                                        .doOnCancel(() -> log.info("客户端断开连接，取消上游流"))
                                        .map(bytes -> Mono.just(bufferFactory.wrap(bytes)))
                        );
                    }
                    exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    return exchange.getResponse().writeWith(
                            CopilotApiClient.rawChunks(upstream).map(bufferFactory::wrap)
                    );
                });
    }

    /**
     * GET /v1/models
     */
    @GetMapping(value = {"/v1/models", "/models"}, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> listModels(ServerWebExchange exchange) {
        String callerToken = CallerTokenFilter.getCallerToken(exchange);
        return Mono.fromCallable(() -> catalog.getModels(authService.resolve(callerToken)).toJson().toJSONString())
                .subscribeOn(Schedulers.boundedElastic());
    }

    // ==================== 辅助方法 ====================

    /**
     * 任一消息包含 image_url 内容片段
     */
    static boolean hasImageContent(JSONObject request) {
        JSONArray messages = request.getJSONArray("messages");
        if (messages == null) {
            return false;
        }
        for (int i = 0; i < messages.size(); i++) {
            Object message = messages.get(i);
            if (!(message instanceof JSONObject messageObject)) {
                continue;
            }
            Object content = messageObject.get("content");
            if (!(content instanceof JSONArray parts)) {
                continue;
            }
            for (int j = 0; j < parts.size(); j++) {
                if (parts.get(j) instanceof JSONObject part && "image_url".equals(part.getString("type"))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * 出现 assistant 或 tool 消息即视为 agent 发起
     */
    static boolean isAgentCall(JSONObject request) {
        JSONArray messages = request.getJSONArray("messages");
        if (messages == null) {
            return false;
        }
        for (int i = 0; i < messages.size(); i++) {
            if (messages.get(i) instanceof JSONObject message) {
                String role = message.getString("role");
                if ("assistant".equals(role) || "tool".equals(role)) {
                    return true;
                }
            }
        }
        return false;
    }
}
