package com.work.bundler.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 响应信封：成功为 { jsonrpc, result, id }（result 可以是 null），失败为 { jsonrpc, error, id }。
 */
public abstract class JsonRpcResponse {

    private final JsonNode id;

    protected JsonRpcResponse(JsonNode id) {
        this.id = id;
    }

    public static JsonRpcResponse success(JsonNode id, Object result) {
        return new Success(id, result);
    }

    public static JsonRpcResponse failure(JsonNode id, int code, String message, int httpStatus) {
        return new Failure(id, new JsonRpcError(code, message), httpStatus);
    }

    public String getJsonrpc() {
        return "2.0";
    }

    public JsonNode getId() {
        return id;
    }

    @JsonIgnore
    public abstract int getHttpStatus();

    public static class Success extends JsonRpcResponse {

        private final Object result;

        Success(JsonNode id, Object result) {
            super(id);
            this.result = result;
        }

        @JsonInclude(JsonInclude.Include.ALWAYS)
        public Object getResult() {
            return result;
        }

        @Override
        public int getHttpStatus() {
            return 200;
        }
    }

    public static class Failure extends JsonRpcResponse {

        private final JsonRpcError error;
        private final int httpStatus;

        Failure(JsonNode id, JsonRpcError error, int httpStatus) {
            super(id);
            this.error = error;
            this.httpStatus = httpStatus;
        }

        public JsonRpcError getError() {
            return error;
        }

        @Override
        public int getHttpStatus() {
            return httpStatus;
        }
    }
}
