package com.work.bundler.core.exception;

/**
 * 组件内部的统一异常类型，便于 RPC 层捕获并转换为 JSON-RPC 错误码。
 */
public class BundlerException extends RuntimeException {

    public BundlerException(String message) {
        super(message);
    }

    public BundlerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决（链 RPC 不可达、存储超时等）。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
