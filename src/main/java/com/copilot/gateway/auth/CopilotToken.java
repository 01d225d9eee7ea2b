package com.copilot.gateway.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Copilot API token（由 GitHub token 交换得到的短期凭证）
 * <p>
 * 不可变，刷新时整体替换
 *
 * @param refreshMargin 距离过期多久开始刷新
 */
public record CopilotToken(String value, Instant expiresAt, Duration refreshMargin) {

    public Instant refreshAt() {
        return expiresAt.minus(refreshMargin);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean needsRefresh(Instant now) {
        return !now.isBefore(refreshAt());
    }

    @Override
    public String toString() {
        String masked = value != null && value.length() > 8 ? value.substring(0, 8) + "***" : "***";
        return "CopilotToken[value=" + masked + ", expiresAt=" + expiresAt + "]";
    }
}
