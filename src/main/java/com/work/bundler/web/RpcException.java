package com.work.bundler.web;

import com.work.bundler.core.exception.BundlerException;

/**
 * 需要以指定 JSON-RPC 错误码返回给调用方的异常。
 */
public class RpcException extends BundlerException {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    /**
     * ERC-4337 约定：UserOperation 被 EntryPoint 模拟拒绝。
     */
    public static final int REJECTED_BY_ENTRY_POINT = -32500;

    private final int code;

    public RpcException(int code, String message) {
        super(message);
        this.code = code;
    }

    public RpcException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * 请求本身有问题（方法名、参数）时返回 400，其余 500。
     */
    public int httpStatus() {
        return code == METHOD_NOT_FOUND || code == INVALID_PARAMS || code == INVALID_REQUEST || code == PARSE_ERROR ? 400 : 500;
    }
}
