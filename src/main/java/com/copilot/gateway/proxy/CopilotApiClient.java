package com.copilot.gateway.proxy;

import com.copilot.gateway.config.AppProperties;
import com.copilot.gateway.exception.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Copilot chat completions 客户端
 * <p>
 * 阻塞调用，由控制器放到 boundedElastic 线程执行；流式响应通过 {@link #dataEvents} 转成 Flux，
 * 取消订阅时关闭连接
 */
@Component
public class CopilotApiClient {

    private static final Logger log = LoggerFactory.getLogger(CopilotApiClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(10);

    private final HttpClient httpClient;
    private final AppProperties properties;

    public CopilotApiClient(HttpClient copilotHttpClient, AppProperties properties) {
        this.httpClient = copilotHttpClient;
        this.properties = properties;
    }

    /**
     * 发送 chat completions 请求并建立连接
     * <p>
     * 非 2xx 时读取错误体并抛出 {@link UpstreamException}；成功时调用方负责关闭返回值
     *
     * @param body         请求体 JSON
     * @param copilotToken Copilot token
     * @param vision       请求包含图片
     * @param agent        是否由 agent 发起（x-initiator）
     */
    public UpstreamResponse chatCompletions(String body, String copilotToken, boolean vision, boolean agent) {
        String url = CopilotHeaders.baseUrl(properties.getAccountType()) + "/chat/completions";
        log.debug("调用 Copilot API: url={}, bodySize={}, vision={}, agent={}", url, body.length(), vision, agent);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .headers(CopilotHeaders.copilot(copilotToken, properties.getVscodeVersion(), vision, agent ? "agent" : "user"))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<InputStream> response = send(request);
        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            String errorBody = readBody(response.body());
            log.error("Copilot API 返回错误: status={}, body={}", statusCode, errorBody);
            throw new UpstreamException(statusCode, errorBody);
        }
        String contentType = response.headers().firstValue("content-type").orElse(null);
        return new UpstreamResponse(statusCode, contentType, response.body());
    }

    /**
     * 非流式调用，返回完整响应体
     */
    public String chatCompletionsBody(String body, String copilotToken, boolean vision, boolean agent) {
        try (UpstreamResponse response = chatCompletions(body, copilotToken, vision, agent)) {
            return readBody(response.body());
        }
    }

    /**
     * 将 SSE 响应转换为 data 负载流，遇到 [DONE] 结束
     * <p>
     * 订阅取消或结束时关闭上游连接
     */
    public static Flux<String> dataEvents(UpstreamResponse response) {
        return Flux.using(
                () -> new BufferedReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8)),
                reader -> {
                    SseLineParser parser = new SseLineParser();
                    return Flux.fromStream(reader.lines())
                            .concatWith(Flux.just(""))
                            .<String>handle((line, sink) -> {
                                String data = parser.feed(line);
                                if (data != null) {
                                    sink.next(data);
                                }
                            })
                            .takeWhile(data -> !SseLineParser.DONE.equals(data));
                },
                reader -> response.close()
        ).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 原样转发响应字节，取消订阅时关闭上游连接
     */
    public static Flux<byte[]> rawChunks(UpstreamResponse response) {
        return Flux.using(
                () -> response.body(),
                in -> Flux.<byte[]>generate(sink -> {
                    try {
                        byte[] buffer = new byte[8192];
                        int read = in.read(buffer);
                        if (read < 0) {
                            sink.complete();
                        } else {
                            byte[] chunk = new byte[read];
                            System.arraycopy(buffer, 0, chunk, 0, read);
                            sink.next(chunk);
                        }
                    } catch (IOException e) {
                        sink.error(e);
                    }
                }),
                in -> response.close()
        ).subscribeOn(Schedulers.boundedElastic());
    }

    // ==================== 辅助方法 ====================

    private HttpResponse<InputStream> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            log.error("调用 Copilot API 异常: {}", e.getMessage());
            throw new UpstreamException(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("请求被中断", e);
        }
    }

    static String readBody(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UpstreamException("读取响应失败: " + e.getMessage(), e);
        }
    }
}
