package com.copilot.gateway.controller;

import com.copilot.gateway.auth.TokenExtractor;
import com.copilot.gateway.proxy.CopilotHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * 调用方 token 提取过滤器
 * <p>
 * 从请求头取出调用方的 GitHub token 放入 exchange 属性；是否必须提供由 AuthService 判断
 */
@Component
@Order(10)
public class CallerTokenFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(CallerTokenFilter.class);

    static final String CALLER_TOKEN_ATTR = CallerTokenFilter.class.getName() + ".callerToken";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String token = TokenExtractor.extract(exchange.getRequest().getHeaders());
        if (token != null) {
            exchange.getAttributes().put(CALLER_TOKEN_ATTR, token);
            log.debug("请求 {} 携带调用方 token: {}", exchange.getRequest().getPath().value(), CopilotHeaders.mask(token));
        }
        return chain.filter(exchange);
    }

    /**
     * @return 调用方 GitHub token，未提供时返回 null
     */
    public static String getCallerToken(ServerWebExchange exchange) {
        return exchange.getAttribute(CALLER_TOKEN_ATTR);
    }
}
