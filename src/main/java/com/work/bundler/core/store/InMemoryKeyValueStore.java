package com.work.bundler.core.store;

import com.work.bundler.core.support.ValidationUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 使用 ConcurrentHashMap 模拟 Redis 过期语义的简单实现（本地联调 / 单测）。
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static class Entry {
        final String value;
        final Instant expireAt;

        Entry(String value, Instant expireAt) {
            this.value = value;
            this.expireAt = expireAt;
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public String get(String key) {
        Entry e = entries.get(key);
        if (e == null) {
            return null;
        }
        if (e.expireAt.isBefore(Instant.now())) {
            // 惰性过期
            entries.remove(key, e);
            return null;
        }
        return e.value;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        ValidationUtils.requirePositive(ttl, "ttl");
        entries.put(key, new Entry(value, Instant.now().plus(ttl)));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }
}
