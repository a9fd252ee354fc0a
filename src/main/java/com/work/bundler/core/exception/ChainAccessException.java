package com.work.bundler.core.exception;

/**
 * 链节点 / 费率预言机访问失败（网络、超时、节点错误）。调用方应重试而不是丢弃。
 */
public class ChainAccessException extends BundlerException {

    public ChainAccessException(String message) {
        super(message);
    }

    public ChainAccessException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
