package com.copilot.gateway.model;

import com.copilot.gateway.auth.AuthService;
import com.copilot.gateway.config.AppProperties;
import com.copilot.gateway.dto.openai.ModelList;
import com.copilot.gateway.exception.GatewayException;
import com.copilot.gateway.proxy.CopilotRestApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 模型列表缓存
 * <p>
 * 按账号类型缓存 Copilot 模型列表，过期后重新获取；获取时对每个模型做名称转换并登记反向映射。
 * 多个上游模型转换成同一名称时只保留第一个
 */
@Component
public class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    private final CopilotRestApi restApi;
    private final ModelRenamer renamer;
    private final AuthService authService;
    private final AppProperties properties;
    private final TtlCache<String, ModelList> cache;

    public ModelCatalog(CopilotRestApi restApi, ModelRenamer renamer, AuthService authService,
                        AppProperties properties, Clock clock) {
        this.restApi = restApi;
        this.renamer = renamer;
        this.authService = authService;
        this.properties = properties;
        this.cache = new TtlCache<>(Duration.ofSeconds(properties.getModels().getCacheTtlSeconds()), clock);
    }

    /**
     * 获取模型列表（客户端模型名）
     *
     * @param copilotToken 缓存未命中时用于请求上游
     */
    public ModelList getModels(String copilotToken) {
        return cache.get(properties.getAccountType(), () -> fetch(copilotToken));
    }

    /**
     * 启动预热，仅在配置了 GH_TOKEN 时执行
     */
    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void warmUp() {
        if (!properties.hasGithubToken()) {
            return;
        }
        try {
            ModelList models = getModels(authService.current().value());
            log.info("模型列表预热完成: {} 个模型", models.data().size());
        } catch (GatewayException e) {
            log.warn("模型列表预热失败，将在首次请求时重试: {}", e.getMessage());
        }
    }

    private ModelList fetch(String copilotToken) {
        ModelList upstream = restApi.listModels(copilotToken);
        List<ModelList.ModelEntry> entries = new ArrayList<>(upstream.data().size());
        Set<String> seen = new LinkedHashSet<>();
        for (ModelList.ModelEntry entry : upstream.data()) {
            String clientId = renamer.toClient(entry.id());
            renamer.register(entry.id(), clientId);
            if (!seen.add(clientId)) {
                log.debug("模型 {} 与已有模型同名（{}），跳过", entry.id(), clientId);
                continue;
            }
            if (!clientId.equals(entry.id())) {
                log.debug("模型名转换: {} → {}", entry.id(), clientId);
            }
            entries.add(entry.withId(clientId));
        }
        log.info("模型列表已更新: 上游 {} 个, 对外 {} 个", upstream.data().size(), entries.size());
        return new ModelList(entries);
    }
}
