package com.work.bundler.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.bundler.core.exception.StoreAccessException;
import com.work.bundler.core.model.DroppedOperation;
import com.work.bundler.core.model.UserOperation;
import com.work.bundler.core.model.UserOperationReceipt;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * UserOperation 相关的持久化读写，key 布局：
 * <ul>
 *     <li>op:&lt;hash&gt; 已入池 op 的暂存（约 1h）</li>
 *     <li>receipt:&lt;hash&gt; 上链结果（约 24h）</li>
 *     <li>dropped:&lt;hash&gt; 重试耗尽的死信（约 24h）</li>
 * </ul>
 * 值统一为 JSON。
 */
public class UserOperationRepository {

    static final String OP_KEY_PREFIX = "op:";
    static final String RECEIPT_KEY_PREFIX = "receipt:";
    static final String DROPPED_KEY_PREFIX = "dropped:";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public UserOperationRepository(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = Objects.requireNonNull(store, "store");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public void stageOperation(String userOpHash, UserOperation op, Duration ttl) {
        store.set(OP_KEY_PREFIX + userOpHash, write(op), ttl);
    }

    public Optional<UserOperation> findStagedOperation(String userOpHash) {
        return read(OP_KEY_PREFIX + userOpHash, UserOperation.class);
    }

    public void saveReceipt(UserOperationReceipt receipt, Duration ttl) {
        store.set(RECEIPT_KEY_PREFIX + receipt.getUserOpHash(), write(receipt), ttl);
    }

    public Optional<UserOperationReceipt> findReceipt(String userOpHash) {
        return read(RECEIPT_KEY_PREFIX + userOpHash, UserOperationReceipt.class);
    }

    public void saveDropped(DroppedOperation dropped, Duration ttl) {
        store.set(DROPPED_KEY_PREFIX + dropped.getUserOpHash(), write(dropped), ttl);
    }

    public Optional<DroppedOperation> findDropped(String userOpHash) {
        return read(DROPPED_KEY_PREFIX + userOpHash, DroppedOperation.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreAccessException("序列化失败: " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        String payload = store.get(key);
        if (payload == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(payload, type));
        } catch (JsonProcessingException e) {
            throw new StoreAccessException("反序列化失败: " + key, e);
        }
    }
}
