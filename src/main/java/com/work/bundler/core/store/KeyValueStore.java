package com.work.bundler.core.store;

import java.time.Duration;

/**
 * 带过期时间的 KV 存储端口（生产为 Redis）。
 *
 * 约定：单 key 的读/写/过期是原子的，不需要跨 key 事务。
 */
public interface KeyValueStore {

    /**
     * 不存在或已过期返回 null。
     */
    String get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);
}
