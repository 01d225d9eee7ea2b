package com.copilot.gateway.auth;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.config.AppProperties;
import com.copilot.gateway.exception.AuthException;
import com.copilot.gateway.proxy.CopilotHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

/**
 * 通过 GitHub copilot_internal 接口交换 Copilot token
 * <p>
 * GET https://api.github.com/copilot_internal/v2/token
 * 响应：{"token": "...", "expires_at": 1700000000, "refresh_in": 1500}
 */
@Component
public class GitHubTokenExchanger implements TokenExchanger {

    private static final Logger log = LoggerFactory.getLogger(GitHubTokenExchanger.class);

    private final HttpClient httpClient;
    private final AppProperties properties;

    public GitHubTokenExchanger(HttpClient copilotHttpClient, AppProperties properties) {
        this.httpClient = copilotHttpClient;
        this.properties = properties;
    }

    @Override
    public ExchangeResult exchange(String githubToken) {
        String tokenUrl = CopilotHeaders.GITHUB_API_BASE_URL + "/copilot_internal/v2/token";

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .timeout(Duration.ofSeconds(30))
                .headers(CopilotHeaders.github(githubToken, properties.getVscodeVersion()))
                .GET()
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.error("Copilot token 交换失败: status={}, body={}", response.statusCode(), response.body());
                throw new AuthException(AuthException.Reason.EXCHANGE_FAILED,
                        "Copilot token exchange failed: " + response.statusCode());
            }

            JSONObject json = JSONObject.parseObject(response.body());
            String token = json != null ? json.getString("token") : null;
            if (token == null || token.isEmpty()) {
                throw new AuthException(AuthException.Reason.EXCHANGE_FAILED, "Copilot token exchange returned no token");
            }
            long expiresAt = json.getLongValue("expires_at");
            if (expiresAt <= 0) {
                throw new AuthException(AuthException.Reason.EXCHANGE_FAILED, "Copilot token exchange returned no expires_at");
            }
            long refreshIn = json.getLongValue("refresh_in");

            log.debug("Copilot token 交换成功: expiresAt={}, refreshIn={}s", expiresAt, refreshIn);
            return new ExchangeResult(token, Instant.ofEpochSecond(expiresAt), refreshIn);

        } catch (JSONException e) {
            throw new AuthException(AuthException.Reason.EXCHANGE_FAILED, "Copilot token 响应解析失败: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new AuthException(AuthException.Reason.EXCHANGE_FAILED, "Copilot token 交换异常: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException(AuthException.Reason.EXCHANGE_FAILED, "Copilot token 交换被中断", e);
        }
    }
}
