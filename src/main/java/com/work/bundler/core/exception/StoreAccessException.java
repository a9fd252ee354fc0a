package com.work.bundler.core.exception;

/**
 * KV 存储（Redis）读写失败或数据无法反序列化。
 */
public class StoreAccessException extends BundlerException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
