package com.work.bundler.core.pool;

import com.work.bundler.core.model.UserOperation;
import com.work.bundler.core.support.ValidationUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 待打包 UserOperation 池：userOpHash -> op。
 *
 * 进程内唯一的共享可变状态，所有读写都在同一把锁内完成：
 * drainAll 拿到快照并清空是一个原子步骤，之后到达的 admit 只会出现在下一轮。
 * 池本身无序，不做优先级排序。
 */
public class UserOperationPool {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PooledOperation> entries = new LinkedHashMap<>();

    /**
     * 入池。同一 hash 重复入池是幂等的（保留原条目及其 attempts）。
     *
     * @return true 表示新增了条目
     */
    public boolean admit(String userOpHash, UserOperation op) {
        ValidationUtils.requireNonEmpty(userOpHash, "userOpHash");
        ValidationUtils.requireNonNull(op, "op");
        lock.lock();
        try {
            if (entries.containsKey(userOpHash)) {
                return false;
            }
            entries.put(userOpHash, PooledOperation.fresh(userOpHash, op));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 入池并替换同一 (sender, nonce) 下内容不同的旧条目（新者胜），查找、驱逐、插入在同一把锁内完成。
     */
    public AdmitOutcome admitReplacing(String userOpHash, UserOperation op) {
        ValidationUtils.requireNonEmpty(userOpHash, "userOpHash");
        ValidationUtils.requireNonNull(op, "op");
        lock.lock();
        try {
            if (entries.containsKey(userOpHash)) {
                return new AdmitOutcome(false, null);
            }
            PooledOperation replaced = findLocked(op.getSender(), op.getNonce());
            if (replaced != null) {
                entries.remove(replaced.getUserOpHash());
            }
            entries.put(userOpHash, PooledOperation.fresh(userOpHash, op));
            return new AdmitOutcome(true, replaced);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String userOpHash) {
        lock.lock();
        try {
            return entries.containsKey(userOpHash);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 原子地取出并清空全部条目。
     */
    public List<PooledOperation> drainAll() {
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return new ArrayList<>();
            }
            List<PooledOperation> snapshot = new ArrayList<>(entries.values());
            entries.clear();
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 提交失败后回池：按条目自己的 userOpHash 重新入池，attempts+1。
     * 在途期间同 (sender, nonce) 已有新 op 入池的条目直接丢弃（superseded），不计入重试；
     * attempts 达到 maxAttempts 的条目不再回池，放入 exhausted 交由调用方做死信处理；
     * 期间同 hash 已被重新 admit 的条目保持池内现状。
     */
    public RequeueOutcome requeue(List<PooledOperation> failed, int maxAttempts, String error) {
        List<PooledOperation> requeued = new ArrayList<>();
        List<PooledOperation> exhausted = new ArrayList<>();
        List<PooledOperation> superseded = new ArrayList<>();
        if (failed == null || failed.isEmpty()) {
            return new RequeueOutcome(requeued, exhausted, superseded);
        }
        int max = Math.max(1, maxAttempts);
        lock.lock();
        try {
            for (PooledOperation p : failed) {
                PooledOperation pooled = findLocked(p.getOperation().getSender(), p.getOperation().getNonce());
                if (pooled != null && !pooled.getUserOpHash().equals(p.getUserOpHash())) {
                    superseded.add(p);
                    continue;
                }
                PooledOperation next = p.afterFailure(error);
                if (next.getAttempts() >= max) {
                    exhausted.add(next);
                    continue;
                }
                if (entries.putIfAbsent(next.getUserOpHash(), next) == null) {
                    requeued.add(next);
                }
            }
        } finally {
            lock.unlock();
        }
        return new RequeueOutcome(requeued, exhausted, superseded);
    }

    /**
     * 移除指定条目。
     */
    public Optional<PooledOperation> evict(String userOpHash) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.remove(userOpHash));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 查找同一 (sender, nonce) 的池内条目。
     */
    public Optional<PooledOperation> findBySenderAndNonce(String sender, BigInteger nonce) {
        lock.lock();
        try {
            return Optional.ofNullable(findLocked(sender, nonce));
        } finally {
            lock.unlock();
        }
    }

    // 调用方须持有 lock
    private PooledOperation findLocked(String sender, BigInteger nonce) {
        for (PooledOperation p : entries.values()) {
            UserOperation op = p.getOperation();
            if (ValidationUtils.sameAddress(op.getSender(), sender) && op.getNonce().equals(nonce)) {
                return p;
            }
        }
        return null;
    }
}
