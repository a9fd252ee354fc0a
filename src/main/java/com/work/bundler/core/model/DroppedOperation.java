package com.work.bundler.core.model;

/**
 * 死信记录：op 连续提交失败达到上限后不再回池，写入 dropped:&lt;hash&gt; 供排障查询。
 */
public class DroppedOperation {

    private String userOpHash;
    private UserOperation operation;
    private int attempts;
    private String lastError;
    private long droppedAt;

    public DroppedOperation() {
    }

    public DroppedOperation(String userOpHash, UserOperation operation, int attempts, String lastError, long droppedAt) {
        this.userOpHash = userOpHash;
        this.operation = operation;
        this.attempts = attempts;
        this.lastError = lastError;
        this.droppedAt = droppedAt;
    }

    public String getUserOpHash() {
        return userOpHash;
    }

    public void setUserOpHash(String userOpHash) {
        this.userOpHash = userOpHash;
    }

    public UserOperation getOperation() {
        return operation;
    }

    public void setOperation(UserOperation operation) {
        this.operation = operation;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    /**
     * epoch millis
     */
    public long getDroppedAt() {
        return droppedAt;
    }

    public void setDroppedAt(long droppedAt) {
        this.droppedAt = droppedAt;
    }
}
