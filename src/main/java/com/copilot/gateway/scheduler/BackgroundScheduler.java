package com.copilot.gateway.scheduler;

import com.copilot.gateway.auth.AuthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 后台定时任务调度器
 * <p>
 * 运营方 token 的刷新由 AuthService 按过期时间单独调度，这里只做周期清理
 */
@Component
public class BackgroundScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundScheduler.class);

    private final AuthService authService;

    public BackgroundScheduler(AuthService authService) {
        this.authService = authService;
    }

    /**
     * 清理过期的调用方 Copilot token（默认每 10 分钟）
     */
    @Scheduled(fixedRateString = "${copilot.auth.eviction-interval-ms:600000}")
    public void evictExpiredTokens() {
        try {
            authService.evictExpired();
        } catch (Exception e) {
            log.error("清理过期 token 失败", e);
        }
    }
}
