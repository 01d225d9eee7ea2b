package com.copilot.gateway.auth;

import java.time.Instant;

/**
 * GitHub token → Copilot token 交换
 */
public interface TokenExchanger {

    /**
     * 执行一次交换
     *
     * @param githubToken GitHub 长期 token
     * @return 交换结果
     * @throws com.copilot.gateway.exception.AuthException 交换失败（EXCHANGE_FAILED）
     */
    ExchangeResult exchange(String githubToken);

    /**
     * 交换结果
     *
     * @param token          Copilot token
     * @param expiresAt      过期时间
     * @param refreshInSeconds 上游建议的刷新间隔（秒），仅用于日志
     */
    record ExchangeResult(String token, Instant expiresAt, long refreshInSeconds) {}
}
