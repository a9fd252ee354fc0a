package com.work.bundler.core.pool;

import com.work.bundler.core.model.UserOperation;

import java.time.Instant;

/**
 * 池内条目：op 本身 + 已失败的提交次数（用于死信判定）。
 */
public final class PooledOperation {

    private final String userOpHash;
    private final UserOperation operation;
    private final int attempts;
    private final Instant admittedAt;
    private final String lastError;

    public PooledOperation(String userOpHash, UserOperation operation, int attempts, Instant admittedAt, String lastError) {
        this.userOpHash = userOpHash;
        this.operation = operation;
        this.attempts = attempts;
        this.admittedAt = admittedAt;
        this.lastError = lastError;
    }

    static PooledOperation fresh(String userOpHash, UserOperation operation) {
        return new PooledOperation(userOpHash, operation, 0, Instant.now(), null);
    }

    /**
     * 一次失败提交之后的新条目（op 与 hash 不变，attempts+1）。
     */
    PooledOperation afterFailure(String error) {
        return new PooledOperation(userOpHash, operation, attempts + 1, admittedAt, error);
    }

    public String getUserOpHash() {
        return userOpHash;
    }

    public UserOperation getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getAdmittedAt() {
        return admittedAt;
    }

    public String getLastError() {
        return lastError;
    }
}
