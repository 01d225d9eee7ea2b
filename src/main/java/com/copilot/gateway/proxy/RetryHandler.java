package com.copilot.gateway.proxy;

import com.copilot.gateway.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 指数退避
 * <p>
 * delay = min(base × 2^attempt, maxDelay)，不限制重试次数
 */
@Component
public class RetryHandler {

    private final long baseDelayMs;
    private final long maxDelayMs;

    @Autowired
    public RetryHandler(AppProperties properties) {
        this(properties.getRetry().getBaseDelayMs(), properties.getRetry().getMaxDelayMs());
    }

    public RetryHandler(long baseDelayMs, long maxDelayMs) {
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * 计算第 attempt 次（从 0 开始）重试前的等待时间（毫秒）
     */
    public long getDelay(int attempt) {
        // 2^30 以上已经必然超过上限，避免溢出
        if (attempt >= 30) {
            return maxDelayMs;
        }
        long delay = baseDelayMs * (1L << attempt);
        return Math.min(delay, maxDelayMs);
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }
}
