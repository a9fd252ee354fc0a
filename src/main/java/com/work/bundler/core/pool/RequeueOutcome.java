package com.work.bundler.core.pool;

import java.util.Collections;
import java.util.List;

/**
 * 失败回池的结果：重新入池的条目、已耗尽重试次数的条目、已被同 (sender, nonce) 新 op 替换而丢弃的条目。
 */
public class RequeueOutcome {

    private final List<PooledOperation> requeued;
    private final List<PooledOperation> exhausted;
    private final List<PooledOperation> superseded;

    public RequeueOutcome(List<PooledOperation> requeued, List<PooledOperation> exhausted) {
        this(requeued, exhausted, Collections.emptyList());
    }

    public RequeueOutcome(List<PooledOperation> requeued, List<PooledOperation> exhausted,
                          List<PooledOperation> superseded) {
        this.requeued = Collections.unmodifiableList(requeued);
        this.exhausted = Collections.unmodifiableList(exhausted);
        this.superseded = Collections.unmodifiableList(superseded);
    }

    public List<PooledOperation> getRequeued() {
        return requeued;
    }

    public List<PooledOperation> getExhausted() {
        return exhausted;
    }

    public List<PooledOperation> getSuperseded() {
        return superseded;
    }
}
