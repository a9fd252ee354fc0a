package com.work.bundler.core.pool;

import java.util.Optional;

/**
 * 入池结果：是否新增 + 被同 (sender, nonce) 新 op 替换掉的旧条目。
 */
public class AdmitOutcome {

    private final boolean added;
    private final PooledOperation replaced;

    public AdmitOutcome(boolean added, PooledOperation replaced) {
        this.added = added;
        this.replaced = replaced;
    }

    public boolean isAdded() {
        return added;
    }

    public Optional<PooledOperation> getReplaced() {
        return Optional.ofNullable(replaced);
    }
}
