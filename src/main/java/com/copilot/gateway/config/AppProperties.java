package com.copilot.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "copilot")
public class AppProperties {

    // 运营方配置的 GitHub token，存在时优先于调用方传入的 token
    private String githubToken = "";
    private String accountType = "individual";
    private String vscodeVersion = "1.100.0";
    private RenameConfig rename = new RenameConfig();
    private ThinkingConfig thinking = new ThinkingConfig();
    private ModelsConfig models = new ModelsConfig();
    private AuthConfig auth = new AuthConfig();
    private RetryConfig retry = new RetryConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private LoggingConfig logging = new LoggingConfig();

    public boolean hasGithubToken() {
        return githubToken != null && !githubToken.isBlank();
    }

    // --- 嵌套配置类 ---

    @Data
    public static class RenameConfig {
        // 是否启用基于规则的模型名自动转换
        private boolean auto = true;
        // JSON 对象：{"backend-name": "client-name"}
        private String map = "";
    }

    @Data
    public static class ThinkingConfig {
        private boolean emulate = true;
        private String prompt = "Before answering, think through the problem step by step inside "
                + "<thinking>...</thinking> tags. Put only your reasoning inside the tags, "
                + "then give your final answer after the closing tag.";
    }

    @Data
    public static class ModelsConfig {
        // 0 表示不缓存
        private long cacheTtlSeconds = 300;
    }

    @Data
    public static class AuthConfig {
        private long refreshMarginSeconds = 60;
        private long evictionIntervalMs = 600000;
    }

    @Data
    public static class RetryConfig {
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30000;
    }

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
    }

    @Data
    public static class LoggingConfig {
        private String filePath = "data/logs";
        private String maxFileSize = "100MB";
        private int maxHistory = 30;
        private String totalSizeCap = "1GB";
    }
}
