package com.copilot.gateway.model;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.copilot.gateway.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 模型名双向转换
 * <p>
 * 上游（Copilot）模型名 → 客户端模型名：
 * 1. 显式映射（MODEL_RENAME_MAP）优先
 * 2. 去掉末尾日期（-20250115 / -2025-01-15）
 * 3. claude 规则：版本在前时调整顺序（claude-3.5-sonnet → claude-sonnet-3-5），数字间的点改为横线
 * <p>
 * 反向转换依次查显式映射、从模型列表学到的映射，最后按规则把版本号还原为点号形式
 */
@Component
public class ModelRenamer {

    private static final Logger log = LoggerFactory.getLogger(ModelRenamer.class);

    private static final Pattern DATE_SUFFIX = Pattern.compile("-(\\d{8}|\\d{4}-\\d{2}-\\d{2})$");
    private static final Pattern VERSION_DOT = Pattern.compile("(?<=\\d)\\.(?=\\d)");
    // claude-{variant}-{major}-{minor}[-...]
    private static final Pattern DASHED_VERSION = Pattern.compile("^(claude-[a-z]+(?:-[a-z]+)*-\\d+)-(\\d+)(?=-|$)");

    private final boolean autoEnabled;
    // backend -> client
    private final Map<String, String> overrides;
    // client -> backend
    private final Map<String, String> reverseOverrides;
    // client -> backend，从模型列表学习
    private final Map<String, String> learnedReverse = new ConcurrentHashMap<>();

    @Autowired
    public ModelRenamer(AppProperties properties) {
        this(properties.getRename().isAuto(), parseOverrides(properties.getRename().getMap()));
    }

    public ModelRenamer(boolean autoEnabled, Map<String, String> overrides) {
        this.autoEnabled = autoEnabled;
        this.overrides = Map.copyOf(overrides);
        Map<String, String> reverse = new HashMap<>();
        overrides.forEach((backend, client) -> reverse.put(client, backend));
        this.reverseOverrides = Map.copyOf(reverse);
        if (autoEnabled || !overrides.isEmpty()) {
            log.info("模型名转换已启用: auto={}, 自定义映射 {} 条", autoEnabled, overrides.size());
        }
    }

    /**
     * 上游模型名 → 客户端模型名
     */
    public String toClient(String backendId) {
        if (backendId == null) {
            return null;
        }
        String override = overrides.get(backendId);
        if (override != null) {
            return override;
        }
        if (!autoEnabled) {
            return backendId;
        }
        String stripped = stripDate(backendId);
        override = overrides.get(stripped);
        if (override != null) {
            return override;
        }
        String renamed = autoRename(stripped);
        return renamed != null ? renamed : stripped;
    }

    /**
     * 客户端模型名 → 上游模型名
     * <p>
     * 多个上游模型折叠成同一客户端名时，返回与客户端名相同的那个，否则返回最先注册的
     */
    public String toBackend(String clientId) {
        if (clientId == null) {
            return null;
        }
        String override = reverseOverrides.get(clientId);
        if (override != null) {
            return override;
        }
        String id = autoEnabled ? stripDate(clientId) : clientId;
        override = reverseOverrides.get(id);
        if (override != null) {
            return override;
        }
        String learned = learnedReverse.get(id);
        if (learned != null) {
            return learned;
        }
        if (autoEnabled) {
            Matcher matcher = DASHED_VERSION.matcher(id);
            if (matcher.find()) {
                return matcher.replaceFirst("$1.$2");
            }
        }
        return id;
    }

    /**
     * 记录模型列表中的一组映射，供反向转换使用
     */
    public void register(String backendId, String clientId) {
        learnedReverse.compute(clientId, (k, existing) ->
                existing == null || backendId.equals(clientId) ? backendId : existing);
    }

    // ==================== 辅助方法 ====================

    static String stripDate(String id) {
        return DATE_SUFFIX.matcher(id).replaceFirst("");
    }

    /**
     * claude 模型的规则转换，无需转换时返回 null
     */
    static String autoRename(String name) {
        if (!name.startsWith("claude-")) {
            return null;
        }
        String rest = name.substring("claude-".length());
        String[] segments = rest.split("-");
        if (!startsWithDigit(segments[0])) {
            String normalized = replaceVersionDots(rest);
            return normalized.equals(rest) ? null : "claude-" + normalized;
        }

        // 版本在前：claude-{版本段}-{型号段}
        int versionEnd = 0;
        while (versionEnd < segments.length && startsWithDigit(segments[versionEnd])) {
            versionEnd++;
        }
        if (versionEnd == segments.length) {
            return null;
        }
        String version = String.join("-", Arrays.copyOfRange(segments, 0, versionEnd));
        String variant = String.join("-", Arrays.copyOfRange(segments, versionEnd, segments.length));
        return "claude-" + variant + "-" + replaceVersionDots(version);
    }

    static String replaceVersionDots(String s) {
        return VERSION_DOT.matcher(s).replaceAll("-");
    }

    private static boolean startsWithDigit(String segment) {
        return !segment.isEmpty() && Character.isDigit(segment.charAt(0));
    }

    static Map<String, String> parseOverrides(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            JSONObject json = JSONObject.parseObject(raw);
            if (json == null) {
                return Map.of();
            }
            Map<String, String> result = new HashMap<>();
            for (Map.Entry<String, Object> entry : json.entrySet()) {
                if (entry.getValue() instanceof String value) {
                    result.put(entry.getKey(), value);
                } else {
                    log.warn("MODEL_RENAME_MAP 中 '{}' 的值不是字符串，已忽略", entry.getKey());
                }
            }
            return result;
        } catch (JSONException e) {
            log.warn("MODEL_RENAME_MAP 不是合法的 JSON 对象，已忽略: {}", e.getMessage());
            return Map.of();
        }
    }
}
