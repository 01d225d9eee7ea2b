package com.copilot.gateway.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 带过期时间的缓存，同一个 key 同时最多只有一次加载在进行
 * <p>
 * 加载期间到达的调用方等待同一个结果；加载失败时异常抛给所有等待者，原有条目保持不变
 *
 * @param <K> 缓存 key
 * @param <V> 缓存值
 */
public class TtlCache<K, V> {

    /**
     * 缓存条目，刷新时整体替换
     *
     * @param ttl 为 0 时条目永不新鲜
     */
    public record CacheEntry<V>(V value, Instant fetchedAt, Duration ttl) {

        public boolean isFresh(Instant now) {
            return !ttl.isZero() && now.isBefore(fetchedAt.plus(ttl));
        }
    }

    private final Clock clock;
    private final Duration ttl;
    private final ConcurrentHashMap<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    public TtlCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * 获取缓存值，过期或不存在时调用 loader 加载
     */
    public V get(K key, Supplier<V> loader) {
        CacheEntry<V> entry = entries.get(key);
        if (entry != null && entry.isFresh(clock.instant())) {
            return entry.value();
        }

        CompletableFuture<V> pending = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, pending);
        if (existing != null) {
            return await(existing);
        }

        try {
            // 双重检查：上一次加载可能刚好完成
            entry = entries.get(key);
            if (entry != null && entry.isFresh(clock.instant())) {
                pending.complete(entry.value());
                return entry.value();
            }
            V value = loader.get();
            entries.put(key, new CacheEntry<>(value, clock.instant(), ttl));
            pending.complete(value);
            return value;
        } catch (RuntimeException e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, pending);
        }
    }

    public CacheEntry<V> peek(K key) {
        return entries.get(key);
    }

    public void invalidate(K key) {
        entries.remove(key);
    }

    private V await(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
