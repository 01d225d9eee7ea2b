package com.copilot.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * GitHub token 交换与 Copilot API 共用的 HttpClient
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean
    public HttpClient copilotHttpClient(AppProperties properties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1);

        AppProperties.ProxyConfig proxy = properties.getProxy();
        if (proxy.isEnabled()) {
            InetSocketAddress address = parseProxyAddress(proxy.getUrl());
            if (address != null) {
                builder.proxy(ProxySelector.of(address));
                log.info("HTTP 代理已配置: {}:{}", address.getHostString(), address.getPort());
            } else {
                log.warn("代理 URL 无效: '{}', 将直连 GitHub", proxy.getUrl());
            }
        }
        return builder.build();
    }

    /**
     * 解析代理地址，未写端口时按 scheme 取默认端口
     *
     * @return 无法解析时返回 null
     */
    static InetSocketAddress parseProxyAddress(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        URI uri;
        try {
            uri = URI.create(url.contains("://") ? url.trim() : "http://" + url.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (uri.getHost() == null) {
            return null;
        }
        int port = uri.getPort();
        if (port <= 0) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return InetSocketAddress.createUnresolved(uri.getHost(), port);
    }
}
