package com.work.bundler.web.dto;

/**
 * 稳定的 { code, message } 错误体。
 */
public class JsonRpcError {

    private final int code;
    private final String message;

    public JsonRpcError(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
