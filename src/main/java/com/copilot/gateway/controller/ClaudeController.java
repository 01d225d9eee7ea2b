package com.copilot.gateway.controller;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.copilot.gateway.auth.AuthService;
import com.copilot.gateway.config.AppProperties;
import com.copilot.gateway.dto.claude.ClaudeRequest;
import com.copilot.gateway.dto.claude.ClaudeResponse;
import com.copilot.gateway.dto.claude.StreamEvent;
import com.copilot.gateway.dto.openai.ChatCompletionRequest;
import com.copilot.gateway.dto.openai.ChatCompletionResponse;
import com.copilot.gateway.exception.StreamException;
import com.copilot.gateway.exception.UpstreamException;
import com.copilot.gateway.model.ModelRenamer;
import com.copilot.gateway.proxy.CopilotApiClient;
import com.copilot.gateway.translator.ClaudeRequestTranslator;
import com.copilot.gateway.translator.ClaudeResponseTranslator;
import com.copilot.gateway.translator.ClaudeStreamTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;

/**
 * Anthropic Messages 兼容 API 端点
 * <p>
 * POST /v1/messages：流式 + 非流式
 */
@RestController
@RequestMapping("/v1")
public class ClaudeController {

    private static final Logger log = LoggerFactory.getLogger(ClaudeController.class);

    private final AuthService authService;
    private final CopilotApiClient copilotClient;
    private final ClaudeRequestTranslator requestTranslator;
    private final ClaudeResponseTranslator responseTranslator;
    private final ModelRenamer renamer;
    private final AppProperties properties;

    public ClaudeController(AuthService authService, CopilotApiClient copilotClient,
                            ClaudeRequestTranslator requestTranslator, ClaudeResponseTranslator responseTranslator,
                            ModelRenamer renamer, AppProperties properties) {
        this.authService = authService;
        this.copilotClient = copilotClient;
        this.requestTranslator = requestTranslator;
        this.responseTranslator = responseTranslator;
        this.renamer = renamer;
        this.properties = properties;
    }

    /**
     * POST /v1/messages
     */
    @PostMapping(value = "/messages")
    public Mono<Void> messages(@RequestBody String body, ServerWebExchange exchange) {
        ClaudeRequest request = ClaudeRequest.parse(JSONObject.parseObject(body));
        ChatCompletionRequest translated = requestTranslator.translate(request);
        String payload = translated.toJson().toJSONString();
        boolean vision = request.hasVisionContent();
        boolean agent = request.isAgentCall();
        boolean thinkingActive = properties.getThinking().isEmulate() && request.thinkingEnabled();
        String callerToken = CallerTokenFilter.getCallerToken(exchange);

        log.info("Claude 请求: model={} → {}, stream={}, messages={}, tools={}",
                request.model(), translated.model(), request.stream(), request.messages().size(), request.tools().size());

        DataBufferFactory bufferFactory = exchange.getResponse().bufferFactory();

        if (request.stream()) {
            return Mono.fromCallable(() -> copilotClient.chatCompletions(payload, authService.resolve(callerToken), vision, agent))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(upstream -> {
                        exchange.getResponse().getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
                        exchange.getResponse().getHeaders().setCacheControl("no-cache");
                        ClaudeStreamTranslator streamTranslator = new ClaudeStreamTranslator(renamer, translated.model(), thinkingActive);
                        Flux<String> sseFlux = streamEvents(CopilotApiClient.dataEvents(upstream), streamTranslator)
                                .map(ClaudeController::formatEvent);
                        return exchange.getResponse().writeAndFlushWith(
                                sseFlux.map(s -> Mono.just(bufferFactory.wrap(s.getBytes(StandardCharsets.UTF_8))))
                        );
                    });
        }

        // 非流式：直接写 JSON 字节，避免 Jackson 二次序列化
        return Mono.fromCallable(() -> {
            String responseBody = copilotClient.chatCompletionsBody(payload, authService.resolve(callerToken), vision, agent);
            ClaudeResponse response = responseTranslator.translate(parseResponse(responseBody), translated.model(), request.thinkingEnabled());
            return JSON.toJSONString(response.toJson(), JSONWriter.Feature.WriteMapNullValue);
        }).subscribeOn(Schedulers.boundedElastic()).flatMap(responseJson -> {
            exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
            byte[] bytes = responseJson.getBytes(StandardCharsets.UTF_8);
            exchange.getResponse().getHeaders().setContentLength(bytes.length);
            DataBuffer buffer = bufferFactory.wrap(bytes);
            return exchange.getResponse().writeWith(Mono.just(buffer));
        });
    }

    // ==================== 流式响应 ====================

    /**
     * 上游 data 流 → Anthropic 事件流
     * <p>
     * 上游正常结束但没有 finish_reason 时补齐结束事件；上游中断时输出 error 事件后结束
     */
    static Flux<StreamEvent> streamEvents(Flux<String> dataEvents, ClaudeStreamTranslator translator) {
        return dataEvents
                .<StreamEvent>concatMapIterable(translator::translate)
                .concatWith(Flux.defer(() -> Flux.fromIterable(translator.finish())))
                .onErrorResume(e -> {
                    StreamException error = new StreamException("upstream stream aborted: " + e.getMessage(), e);
                    log.error("Copilot 流式响应中断: {}", e.getMessage());
                    return Flux.fromIterable(translator.fail(error));
                })
                .doOnCancel(() -> log.info("客户端断开连接，取消上游流"));
    }

    static String formatEvent(StreamEvent event) {
        return "event: " + event.eventType() + "\ndata: "
                + JSON.toJSONString(event.toJson(), JSONWriter.Feature.WriteMapNullValue) + "\n\n";
    }

    // ==================== 辅助方法 ====================

    /**
     * 上游响应体结构不符时统一转为 502
     */
    static ChatCompletionResponse parseResponse(String responseBody) {
        try {
            JSONObject json = JSONObject.parseObject(responseBody);
            if (json == null) {
                throw new UpstreamException(502, "empty response body");
            }
            return ChatCompletionResponse.parse(json);
        } catch (JSONException | IllegalArgumentException e) {
            throw new UpstreamException("malformed Copilot response: " + e.getMessage(), e);
        }
    }
}
