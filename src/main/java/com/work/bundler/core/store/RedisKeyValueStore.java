package com.work.bundler.core.store;

import com.work.bundler.core.exception.StoreAccessException;
import com.work.bundler.core.support.ValidationUtils;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * 基于 StringRedisTemplate 的实现：SET key value EX ttl / GET key。
 */
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = ValidationUtils.requireNonNull(redisTemplate, "redisTemplate");
    }

    @Override
    public String get(String key) {
        try {
            return redisTemplate.opsForValue().get(key);
        } catch (Exception e) {
            throw new StoreAccessException("Redis 读取异常: " + key, e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        ValidationUtils.requirePositive(ttl, "ttl");
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (Exception e) {
            throw new StoreAccessException("Redis 写入异常: " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (Exception e) {
            throw new StoreAccessException("Redis 删除异常: " + key, e);
        }
    }
}
