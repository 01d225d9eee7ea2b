package com.copilot.gateway.auth;

import org.springframework.http.HttpHeaders;

import java.util.List;

/**
 * 从请求头中提取调用方的 GitHub token
 * <p>
 * 依次检查 x-api-key、Authorization: Bearer、api-key，只接受 GitHub token 前缀的值
 */
public final class TokenExtractor {

    private static final List<String> GITHUB_TOKEN_PREFIXES = List.of("ghp_", "gho_", "ghu_", "github_pat_");

    private TokenExtractor() {
    }

    /**
     * @return GitHub token，没有可用值时返回 null
     */
    public static String extract(HttpHeaders headers) {
        String token = accept(headers.getFirst("x-api-key"));
        if (token != null) {
            return token;
        }

        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null) {
            String bearer = null;
            if (authorization.startsWith("Bearer ")) {
                bearer = authorization.substring(7);
            } else if (authorization.startsWith("bearer ")) {
                bearer = authorization.substring(7);
            }
            token = accept(bearer);
            if (token != null) {
                return token;
            }
        }

        return accept(headers.getFirst("api-key"));
    }

    public static boolean isGitHubToken(String value) {
        if (value == null) {
            return false;
        }
        for (String prefix : GITHUB_TOKEN_PREFIXES) {
            if (value.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String accept(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return isGitHubToken(trimmed) ? trimmed : null;
    }
}
