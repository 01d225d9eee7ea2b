package com.copilot.gateway.proxy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * GitHub / Copilot 请求头
 * <p>
 * 模拟 VS Code Copilot Chat 插件，返回值可直接传给 HttpRequest.Builder#headers
 */
public final class CopilotHeaders {

    public static final String GITHUB_API_BASE_URL = "https://api.github.com";

    private static final String EDITOR_PLUGIN_VERSION = "copilot-chat/0.26.7";
    private static final String USER_AGENT = "GitHubCopilotChat/0.26.7";
    private static final String API_VERSION = "2025-04-01";

    private CopilotHeaders() {
    }

    /**
     * Copilot API 地址，individual 使用默认域名，其他账号类型使用 api.{type}.githubcopilot.com
     */
    public static String baseUrl(String accountType) {
        if (accountType == null || accountType.isBlank() || "individual".equals(accountType)) {
            return "https://api.githubcopilot.com";
        }
        return "https://api." + accountType + ".githubcopilot.com";
    }

    /**
     * 调用 api.github.com 的请求头（token 交换）
     */
    public static String[] github(String githubToken, String vscodeVersion) {
        return new String[]{
                "Content-Type", "application/json",
                "Accept", "application/json",
                "Authorization", "token " + githubToken,
                "editor-version", "vscode/" + vscodeVersion,
                "editor-plugin-version", EDITOR_PLUGIN_VERSION,
                "User-Agent", USER_AGENT,
                "x-github-api-version", API_VERSION,
                "x-vscode-user-agent-library-version", "electron-fetch"
        };
    }

    /**
     * 调用 Copilot API 的请求头
     *
     * @param vision    请求包含图片
     * @param initiator agent / user，为 null 时不发送 x-initiator
     */
    public static String[] copilot(String copilotToken, String vscodeVersion, boolean vision, String initiator) {
        List<String> headers = new ArrayList<>(List.of(
                "Authorization", "Bearer " + copilotToken,
                "Content-Type", "application/json",
                "copilot-integration-id", "vscode-chat",
                "editor-version", "vscode/" + vscodeVersion,
                "editor-plugin-version", EDITOR_PLUGIN_VERSION,
                "User-Agent", USER_AGENT,
                "openai-intent", "conversation-panel",
                "x-github-api-version", API_VERSION,
                "x-request-id", UUID.randomUUID().toString(),
                "x-vscode-user-agent-library-version", "electron-fetch"
        ));
        if (vision) {
            headers.add("copilot-vision-request");
            headers.add("true");
        }
        if (initiator != null) {
            headers.add("x-initiator");
            headers.add(initiator);
        }
        return headers.toArray(new String[0]);
    }

    /**
     * 日志用脱敏：只保留前 8 位
     */
    public static String mask(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() > 8 ? token.substring(0, 8) + "***" : "***";
    }
}
