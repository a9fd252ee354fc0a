package com.work.bundler.core.exception;

/**
 * UserOperation 被拒绝（调用方错误）：模拟校验失败或 revert。不会自动重试。
 */
public class OperationRejectedException extends BundlerException {

    public OperationRejectedException(String message) {
        super(message);
    }

    public OperationRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
