package com.copilot.gateway.proxy;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.config.AppProperties;
import com.copilot.gateway.dto.openai.ModelList;
import com.copilot.gateway.exception.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Copilot REST API 客户端
 * <p>
 * 获取模型列表
 */
@Component
public class CopilotRestApi {

    private static final Logger log = LoggerFactory.getLogger(CopilotRestApi.class);

    private final HttpClient httpClient;
    private final AppProperties properties;

    public CopilotRestApi(HttpClient copilotHttpClient, AppProperties properties) {
        this.httpClient = copilotHttpClient;
        this.properties = properties;
    }

    /**
     * 获取可用模型列表（上游原始 id）
     */
    public ModelList listModels(String copilotToken) {
        String url = CopilotHeaders.baseUrl(properties.getAccountType()) + "/models";

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(30))
                .headers(CopilotHeaders.copilot(copilotToken, properties.getVscodeVersion(), false, null))
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamException("获取模型列表失败: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("获取模型列表被中断", e);
        }

        if (response.statusCode() != 200) {
            log.warn("获取模型列表失败: status={}, body={}", response.statusCode(), response.body());
            throw new UpstreamException(response.statusCode(), response.body());
        }

        try {
            JSONObject json = JSONObject.parseObject(response.body());
            if (json == null) {
                throw new UpstreamException("模型列表为空", null);
            }
            ModelList models = ModelList.parse(json);
            log.debug("获取模型列表成功: {} 个模型", models.data().size());
            return models;
        } catch (JSONException | IllegalArgumentException e) {
            log.error("模型列表解析失败: body={}", response.body());
            throw new UpstreamException("模型列表格式错误: " + e.getMessage(), e);
        }
    }
}
