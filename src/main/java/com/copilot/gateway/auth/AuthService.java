package com.copilot.gateway.auth;

import com.copilot.gateway.config.AppProperties;
import com.copilot.gateway.exception.AuthException;
import com.copilot.gateway.proxy.CopilotHeaders;
import com.copilot.gateway.proxy.RetryHandler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Copilot token 生命周期管理
 * <p>
 * - 运营方 token（GH_TOKEN）：启动时交换，在 expiresAt - refreshMargin 定时刷新，失败按指数退避重试
 * - 调用方 token：按 GitHub token 缓存，进入刷新窗口后在请求时重新交换
 * - 同一 GitHub token 的并发交换只执行一次（锁 + 双重检查）
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppProperties properties;
    private final TokenExchanger exchanger;
    private final TaskScheduler taskScheduler;
    private final RetryHandler retryHandler;
    private final Clock clock;

    // GitHub token -> 调用方的 Copilot token
    private final ConcurrentHashMap<String, CopilotToken> tokenCache = new ConcurrentHashMap<>();
    // GitHub token -> 交换锁（防抖）
    private final ConcurrentHashMap<String, ReentrantLock> exchangeLocks = new ConcurrentHashMap<>();

    private volatile CopilotToken operatorToken;
    private volatile ScheduledFuture<?> refreshTask;
    private final AtomicInteger refreshFailures = new AtomicInteger();

    public AuthService(AppProperties properties, TokenExchanger exchanger, TaskScheduler taskScheduler,
                       RetryHandler retryHandler, Clock clock) {
        this.properties = properties;
        this.exchanger = exchanger;
        this.taskScheduler = taskScheduler;
        this.retryHandler = retryHandler;
        this.clock = clock;
    }

    /**
     * 交换一次 Copilot token
     *
     * @param githubToken GitHub token，为空时使用运营方配置的 token
     */
    public CopilotToken acquire(String githubToken) {
        String token = isBlank(githubToken) ? operatorGithubToken() : githubToken;
        if (token == null) {
            throw AuthException.missingToken();
        }
        TokenExchanger.ExchangeResult result = exchanger.exchange(token);
        return new CopilotToken(result.token(), result.expiresAt(), refreshMargin());
    }

    /**
     * 获取运营方的 Copilot token
     * <p>
     * 尚未交换过时同步交换；已过期且刷新一直未成功时抛出 EXPIRED
     */
    public CopilotToken current() {
        if (!properties.hasGithubToken()) {
            throw AuthException.missingToken();
        }
        CopilotToken token = operatorToken;
        if (token == null) {
            token = initOperatorToken();
        }
        if (token.isExpired(clock.instant())) {
            throw new AuthException(AuthException.Reason.EXPIRED,
                    "Copilot token expired at " + token.expiresAt() + " and has not been refreshed yet");
        }
        return token;
    }

    /**
     * 解析本次请求使用的 Copilot token
     * <p>
     * 配置了 GH_TOKEN 时忽略调用方 token；否则使用调用方 token 交换（带缓存）
     *
     * @param callerToken 调用方在请求头中提供的 GitHub token，可能为 null
     */
    public String resolve(String callerToken) {
        if (properties.hasGithubToken()) {
            return current().value();
        }
        if (isBlank(callerToken)) {
            throw AuthException.missingToken();
        }
        return forCaller(callerToken).value();
    }

    /**
     * 启动时交换运营方 token 并安排刷新
     */
    @EventListener(ApplicationReadyEvent.class)
    @Order(0)
    public void start() {
        if (!properties.hasGithubToken()) {
            log.info("未配置 GH_TOKEN，使用调用方请求头中的 GitHub token");
            return;
        }
        refreshOperatorToken();
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> task = refreshTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * 刷新运营方 token，成功后按新 token 安排下一次刷新，失败时退避重试
     * <p>
     * 刷新失败不影响继续使用尚未过期的旧 token
     */
    void refreshOperatorToken() {
        try {
            CopilotToken token = exchangeOperator();
            refreshFailures.set(0);
            scheduleRefresh(token);
        } catch (RuntimeException e) {
            // 交换器或传输层的任何异常都走退避重试，否则刷新循环会就此停止
            int attempt = refreshFailures.getAndIncrement();
            long delay = retryHandler.getDelay(attempt);
            log.error("Copilot token 刷新失败（第 {} 次），{}ms 后重试: {}", attempt + 1, delay, e.getMessage());
            refreshTask = taskScheduler.schedule(this::refreshOperatorToken, clock.instant().plusMillis(delay));
        }
    }

    /**
     * 清理已过期的调用方 token
     *
     * @return 清理数量
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = tokenCache.size();
        tokenCache.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        exchangeLocks.entrySet().removeIf(entry -> !tokenCache.containsKey(entry.getKey()) && !entry.getValue().isLocked());
        int evicted = before - tokenCache.size();
        if (evicted > 0) {
            log.info("清理过期的调用方 Copilot token: {} 个", evicted);
        }
        return evicted;
    }

    public int cachedCallerCount() {
        return tokenCache.size();
    }

    public boolean hasOperatorToken() {
        return operatorToken != null;
    }

    // ==================== 辅助方法 ====================

    private CopilotToken initOperatorToken() {
        String githubToken = operatorGithubToken();
        ReentrantLock lock = exchangeLocks.computeIfAbsent(githubToken, k -> new ReentrantLock());
        lock.lock();
        try {
            // 双重检查：启动任务或其他请求可能已完成交换
            CopilotToken token = operatorToken;
            if (token != null) {
                return token;
            }
            return exchangeOperator();
        } finally {
            lock.unlock();
        }
    }

    private CopilotToken exchangeOperator() {
        String githubToken = operatorGithubToken();
        ReentrantLock lock = exchangeLocks.computeIfAbsent(githubToken, k -> new ReentrantLock());
        lock.lock();
        try {
            CopilotToken token = acquire(githubToken);
            operatorToken = token;
            log.info("Copilot token 已更新: {}, 过期时间: {}", CopilotHeaders.mask(githubToken), token.expiresAt());
            return token;
        } finally {
            lock.unlock();
        }
    }

    private CopilotToken forCaller(String githubToken) {
        CopilotToken cached = tokenCache.get(githubToken);
        if (cached != null && !cached.needsRefresh(clock.instant())) {
            return cached;
        }

        ReentrantLock lock = exchangeLocks.computeIfAbsent(githubToken, k -> new ReentrantLock());
        lock.lock();
        try {
            // 双重检查：其他请求可能已交换
            cached = tokenCache.get(githubToken);
            if (cached != null && !cached.needsRefresh(clock.instant())) {
                return cached;
            }

            try {
                CopilotToken token = acquire(githubToken);
                tokenCache.put(githubToken, token);
                log.info("调用方 {} 的 Copilot token 已交换, 过期时间: {}", CopilotHeaders.mask(githubToken), token.expiresAt());
                return token;
            } catch (AuthException e) {
                // 旧 token 尚未过期时继续使用
                if (cached != null && !cached.isExpired(clock.instant())) {
                    log.warn("调用方 {} 的 Copilot token 刷新失败，继续使用旧 token: {}", CopilotHeaders.mask(githubToken), e.getMessage());
                    return cached;
                }
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private void scheduleRefresh(CopilotToken token) {
        Instant now = clock.instant();
        Instant at = token.refreshAt();
        if (!at.isAfter(now)) {
            // 有效期短于刷新提前量时避免立即循环刷新
            at = now.plusMillis(retryHandler.baseDelayMs());
        }
        refreshTask = taskScheduler.schedule(this::refreshOperatorToken, at);
        log.info("下次 Copilot token 刷新时间: {}", at);
    }

    private Duration refreshMargin() {
        return Duration.ofSeconds(properties.getAuth().getRefreshMarginSeconds());
    }

    private String operatorGithubToken() {
        return properties.hasGithubToken() ? properties.getGithubToken().trim() : null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
