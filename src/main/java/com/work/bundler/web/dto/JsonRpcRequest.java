package com.work.bundler.web.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 请求信封：{ jsonrpc, method, params, id }。
 */
public class JsonRpcRequest {

    private String jsonrpc = "2.0";

    private String method;

    /**
     * 位置参数数组；缺省视为空数组。
     */
    private JsonNode params;

    /**
     * 原样回显，可以是数字、字符串或 null。
     */
    private JsonNode id;

    public String getJsonrpc() {
        return jsonrpc;
    }

    public void setJsonrpc(String jsonrpc) {
        this.jsonrpc = jsonrpc;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public JsonNode getParams() {
        return params;
    }

    public void setParams(JsonNode params) {
        this.params = params;
    }

    public JsonNode getId() {
        return id;
    }

    public void setId(JsonNode id) {
        this.id = id;
    }
}
